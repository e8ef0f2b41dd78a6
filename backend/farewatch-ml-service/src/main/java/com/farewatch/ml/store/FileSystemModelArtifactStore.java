package com.farewatch.ml.store;

import com.farewatch.ml.service.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each model as {@code <id>_model.json} plus {@code <id>_scaler.json} in one directory.
 * Both blobs are staged under temporary names before either is moved into place. If the
 * detector move fails, the previous scaler is put back so the pair on disk stays matched.
 */
@Component
public class FileSystemModelArtifactStore implements ModelArtifactStore {

  private static final Logger log = LoggerFactory.getLogger(FileSystemModelArtifactStore.class);

  private static final Pattern MODEL_ID = Pattern.compile("[A-Za-z0-9._-]+");
  private static final String MODEL_SUFFIX = "_model.json";
  private static final String SCALER_SUFFIX = "_scaler.json";

  private final Path modelDir;

  public FileSystemModelArtifactStore(@Value("${farewatch.ml.model-dir:models}") String modelDir) {
    this.modelDir = Path.of(modelDir);
    try {
      if (!Files.isDirectory(this.modelDir)) {
        Files.createDirectories(this.modelDir);
        log.info("Created model directory {}", this.modelDir.toAbsolutePath());
      }
    } catch (IOException e) {
      throw new CollaboratorException("Cannot create model directory " + this.modelDir, e);
    }
  }

  @Override
  public void save(String modelId, byte[] detectorBlob, byte[] scalerBlob) {
    requireValidId(modelId);
    Path scalerTarget = modelDir.resolve(modelId + SCALER_SUFFIX);
    Path modelTarget = modelDir.resolve(modelId + MODEL_SUFFIX);
    Path scalerTmp = null;
    Path modelTmp = null;
    Path backup = null;
    try {
      scalerTmp = stage(scalerTarget, scalerBlob);
      modelTmp = stage(modelTarget, detectorBlob);
      if (Files.exists(scalerTarget)) {
        backup = Files.createTempFile(modelDir, scalerTarget.getFileName().toString(), ".bak");
        Files.copy(scalerTarget, backup, StandardCopyOption.REPLACE_EXISTING);
      }
      Files.move(scalerTmp, scalerTarget, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      try {
        Files.move(modelTmp, modelTarget, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (IOException e) {
        restoreScaler(scalerTarget, backup, e);
        throw e;
      }
    } catch (IOException e) {
      throw new CollaboratorException("Failed to persist model " + modelId, e);
    } finally {
      cleanUp(scalerTmp);
      cleanUp(modelTmp);
      cleanUp(backup);
    }
  }

  @Override
  public Optional<ModelArtifacts> load(String modelId) {
    requireValidId(modelId);
    Path model = modelDir.resolve(modelId + MODEL_SUFFIX);
    Path scaler = modelDir.resolve(modelId + SCALER_SUFFIX);
    if (!Files.exists(model) || !Files.exists(scaler)) {
      return Optional.empty();
    }
    try {
      return Optional.of(new ModelArtifacts(Files.readAllBytes(model), Files.readAllBytes(scaler)));
    } catch (IOException e) {
      throw new CollaboratorException("Failed to read model " + modelId, e);
    }
  }

  @Override
  public List<String> listIds() {
    List<String> ids = new ArrayList<>();
    try (Stream<Path> files = Files.list(modelDir)) {
      files.map(p -> p.getFileName().toString())
          .filter(name -> name.endsWith(MODEL_SUFFIX))
          .map(name -> name.substring(0, name.length() - MODEL_SUFFIX.length()))
          .filter(id -> Files.exists(modelDir.resolve(id + SCALER_SUFFIX)))
          .sorted()
          .forEach(ids::add);
    } catch (IOException e) {
      throw new CollaboratorException("Failed to list model directory " + modelDir, e);
    }
    return ids;
  }

  @Override
  public boolean delete(String modelId) {
    requireValidId(modelId);
    try {
      boolean model = Files.deleteIfExists(modelDir.resolve(modelId + MODEL_SUFFIX));
      boolean scaler = Files.deleteIfExists(modelDir.resolve(modelId + SCALER_SUFFIX));
      return model || scaler;
    } catch (IOException e) {
      throw new CollaboratorException("Failed to delete model " + modelId, e);
    }
  }

  private Path stage(Path target, byte[] content) throws IOException {
    Path tmp = Files.createTempFile(modelDir, target.getFileName().toString(), ".tmp");
    Files.write(tmp, content);
    return tmp;
  }

  private void restoreScaler(Path scalerTarget, Path backup, IOException failure) {
    try {
      if (backup != null) {
        Files.move(backup, scalerTarget, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } else {
        Files.deleteIfExists(scalerTarget);
      }
    } catch (IOException e) {
      failure.addSuppressed(e);
      log.error("Could not roll back {} after a failed save", scalerTarget, e);
    }
  }

  private void cleanUp(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
    }
  }

  private static void requireValidId(String modelId) {
    if (modelId == null || !MODEL_ID.matcher(modelId).matches()) {
      throw new IllegalArgumentException("Invalid model id: " + modelId);
    }
  }
}
