package com.farewatch.ml.store;

import com.farewatch.ml.service.CollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemModelArtifactStoreTest {

  @TempDir
  Path dir;

  private FileSystemModelArtifactStore store;

  @BeforeEach
  void setUp() {
    store = new FileSystemModelArtifactStore(dir.resolve("models").toString());
  }

  @Test
  @DisplayName("Should create the model directory and store both blobs per id")
  void shouldSaveAndLoad() {
    store.save("global", bytes("detector"), bytes("scaler"));

    assertThat(dir.resolve("models/global_model.json")).exists();
    assertThat(dir.resolve("models/global_scaler.json")).exists();
    ModelArtifacts loaded = store.load("global").orElseThrow();
    assertThat(new String(loaded.detectorBlob(), StandardCharsets.UTF_8)).isEqualTo("detector");
    assertThat(new String(loaded.scalerBlob(), StandardCharsets.UTF_8)).isEqualTo("scaler");
  }

  @Test
  @DisplayName("Should list only ids that have both artifacts, sorted")
  void shouldListCompleteModels() throws Exception {
    store.save("route-b", bytes("d"), bytes("s"));
    store.save("route-a", bytes("d"), bytes("s"));
    Files.writeString(dir.resolve("models/orphan_model.json"), "{}");

    assertThat(store.listIds()).containsExactly("route-a", "route-b");
  }

  @Test
  @DisplayName("Should report whether anything was deleted")
  void shouldDelete() {
    store.save("route-a", bytes("d"), bytes("s"));

    assertThat(store.delete("route-a")).isTrue();
    assertThat(store.delete("route-a")).isFalse();
    assertThat(store.load("route-a")).isEmpty();
  }

  @Test
  @DisplayName("Should keep the previous pair intact when the detector cannot be moved into place")
  void shouldRollBackScalerWhenDetectorWriteFails() throws Exception {
    store.save("r1", bytes("OLD_DET"), bytes("OLD_SCALER"));
    Path modelFile = dir.resolve("models/r1_model.json");
    Files.delete(modelFile);
    Files.createDirectory(modelFile);
    Files.writeString(modelFile.resolve("blocker"), "x");

    assertThatThrownBy(() -> store.save("r1", bytes("NEW_DET"), bytes("NEW_SCALER")))
        .isInstanceOf(CollaboratorException.class);

    assertThat(Files.readString(dir.resolve("models/r1_scaler.json"))).isEqualTo("OLD_SCALER");
    try (Stream<Path> files = Files.list(dir.resolve("models"))) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .containsExactlyInAnyOrder("r1_model.json", "r1_scaler.json");
    }
  }

  @Test
  @DisplayName("Should leave no scaler behind when the first save of an id fails")
  void shouldRemoveNewScalerWhenFirstSaveFails() throws Exception {
    Path modelFile = dir.resolve("models/r2_model.json");
    Files.createDirectory(modelFile);
    Files.writeString(modelFile.resolve("blocker"), "x");

    assertThatThrownBy(() -> store.save("r2", bytes("DET"), bytes("SCALER")))
        .isInstanceOf(CollaboratorException.class);

    assertThat(dir.resolve("models/r2_scaler.json")).doesNotExist();
  }

  @Test
  @DisplayName("Should reject ids that could escape the model directory")
  void shouldRejectPathTraversal() {
    assertThatThrownBy(() -> store.save("../evil", bytes("d"), bytes("s")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
