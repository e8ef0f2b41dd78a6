package com.farewatch.ml.detector;

/**
 * Seam to the statistical library that actually fits and scores detectors.
 */
public interface DetectorFactory {

  /**
   * Fit a detector on an already standardized matrix.
   *
   * @param scaledRows    training rows, all of the same width
   * @param contamination expected outlier fraction, in (0, 0.5]
   */
  AnomalyDetector fit(double[][] scaledRows, double contamination);

  byte[] serialize(AnomalyDetector detector);

  AnomalyDetector deserialize(byte[] blob);
}
