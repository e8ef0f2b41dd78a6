package com.farewatch.ml.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for serialized models, keyed by model id.
 */
public interface ModelArtifactStore {

  void save(String modelId, byte[] detectorBlob, byte[] scalerBlob);

  Optional<ModelArtifacts> load(String modelId);

  List<String> listIds();

  /**
   * @return true if any artifact existed for the id
   */
  boolean delete(String modelId);
}
