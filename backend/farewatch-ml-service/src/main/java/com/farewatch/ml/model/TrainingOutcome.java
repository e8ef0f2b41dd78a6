package com.farewatch.ml.model;

public record TrainingOutcome(
    String modelId,
    Status status,
    int sampleCount,
    Double contamination,
    Long detectedAnomalies
) {

  public enum Status { TRAINED, SKIPPED_INSUFFICIENT_DATA }

  public static TrainingOutcome skipped(String modelId, int sampleCount) {
    return new TrainingOutcome(modelId, Status.SKIPPED_INSUFFICIENT_DATA, sampleCount, null, null);
  }

  public boolean trained() {
    return status == Status.TRAINED;
  }
}
