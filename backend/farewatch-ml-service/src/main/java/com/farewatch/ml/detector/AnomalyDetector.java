package com.farewatch.ml.detector;

/**
 * A fitted detector over standardized rows. Higher scores are more normal; a negative
 * decision function marks an outlier.
 */
public interface AnomalyDetector {

  double scoreSamples(double[] scaledRow);

  double offset();

  default double decisionFunction(double[] scaledRow) {
    return scoreSamples(scaledRow) - offset();
  }

  default boolean isOutlier(double[] scaledRow) {
    return decisionFunction(scaledRow) < 0;
  }
}
