package com.farewatch.ml.store;

import com.farewatch.ml.detector.AnomalyDetector;
import com.farewatch.ml.feature.StandardScaler;

import java.time.Instant;
import java.util.Objects;

/**
 * A detector and the scaler it was trained behind, published under one model id.
 * Never mutated after construction; retraining publishes a new instance.
 */
public record AnomalyModel(
    String modelId,
    AnomalyDetector detector,
    StandardScaler scaler,
    Instant trainedAt,
    int sampleCount,
    double contamination
) {

  public AnomalyModel {
    Objects.requireNonNull(modelId, "modelId must not be null");
    Objects.requireNonNull(scaler, "scaler must not be null");
  }

  /**
   * Untrained stand-in registered when nothing has been persisted yet. Scoring against it
   * reports the model as unavailable.
   */
  public static AnomalyModel placeholder(String modelId) {
    return new AnomalyModel(modelId, null, StandardScaler.unfitted(), null, 0, 0.0);
  }

  public boolean isTrained() {
    return detector != null && scaler.isFitted();
  }
}
