package com.farewatch.ml.store;

import com.farewatch.ml.service.NotFoundException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of live models, one per id, backed by a {@link ModelArtifactStore}.
 *
 * <p>Publishing swaps the map entry for a new immutable {@link AnomalyModel}; a scorer that
 * already holds the previous instance keeps using it undisturbed. Artifacts are written
 * before the swap, so a failed write leaves the previously published model in place.
 * Publishing and deleting the same id are serialized so disk and memory never disagree.
 */
@Component
public class ModelStore {

  public static final String GLOBAL_MODEL_ID = "global";

  private static final Logger log = LoggerFactory.getLogger(ModelStore.class);

  private final ConcurrentMap<String, AnomalyModel> models = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();
  private final ModelArtifactStore artifacts;
  private final ModelCodec codec;

  public ModelStore(ModelArtifactStore artifacts, ModelCodec codec) {
    this.artifacts = artifacts;
    this.codec = codec;
  }

  /**
   * Load every persisted model. Without a persisted global model an untrained placeholder is
   * registered under {@value #GLOBAL_MODEL_ID}.
   */
  @PostConstruct
  public void loadPersistedModels() {
    for (String id : artifacts.listIds()) {
      try {
        artifacts.load(id)
            .map(a -> codec.decode(id, a))
            .ifPresent(m -> models.put(id, m));
      } catch (RuntimeException e) {
        log.error("Skipping unreadable model '{}': {}", id, e.getMessage(), e);
      }
    }
    if (!models.containsKey(GLOBAL_MODEL_ID)) {
      models.put(GLOBAL_MODEL_ID, AnomalyModel.placeholder(GLOBAL_MODEL_ID));
      log.info("No persisted global model, registered untrained placeholder");
    }
    log.info("Model store ready with {} model(s): {}", models.size(), listIds());
  }

  public Optional<AnomalyModel> get(String modelId) {
    return Optional.ofNullable(models.get(modelId));
  }

  public void put(AnomalyModel model) {
    Objects.requireNonNull(model, "model must not be null");
    ModelArtifacts encoded = codec.encode(model);
    synchronized (lockFor(model.modelId())) {
      artifacts.save(model.modelId(), encoded.detectorBlob(), encoded.scalerBlob());
      AnomalyModel previous = models.put(model.modelId(), model);
      log.info("Published model '{}' (samples={}, replaced={})",
          model.modelId(), model.sampleCount(), previous != null);
    }
  }

  /**
   * @throws NotFoundException if no model is registered under the id
   */
  public void delete(String modelId) {
    synchronized (lockFor(modelId)) {
      if (!models.containsKey(modelId)) {
        throw new NotFoundException("Model not found: " + modelId);
      }
      artifacts.delete(modelId);
      models.remove(modelId);
      log.info("Deleted model '{}'", modelId);
    }
  }

  public List<String> listIds() {
    List<String> ids = new ArrayList<>(models.keySet());
    Collections.sort(ids);
    return ids;
  }

  public int size() {
    return models.size();
  }

  private Object lockFor(String modelId) {
    return locks.computeIfAbsent(modelId, k -> new Object());
  }
}
