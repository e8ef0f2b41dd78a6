package com.farewatch.ml.model;

import java.util.List;

public record AnomalyResult(
    String modelId,
    double isolationScore,
    double predictedPrice,
    double anomalyProbability,
    List<Double> confidenceInterval
) {
  public AnomalyResult {
    confidenceInterval = List.copyOf(confidenceInterval);
  }

  public double lower() {
    return confidenceInterval.get(0);
  }

  public double upper() {
    return confidenceInterval.get(1);
  }
}
