package com.farewatch.ml.detector;

import com.amazon.randomcutforest.RandomCutForest;

import java.util.Objects;

/**
 * {@link AnomalyDetector} backed by a Random Cut Forest.
 *
 * <p>The forest's anomaly score {@code s} (about 1 for typical points, growing for points
 * that are isolated quickly) is mapped to {@code -s / (1 + s)}, which lies in (-1, 0] with
 * higher meaning more normal.
 */
public class RandomCutForestDetector implements AnomalyDetector {

  private final RandomCutForest forest;
  private final double offset;

  RandomCutForestDetector(RandomCutForest forest, double offset) {
    this.forest = Objects.requireNonNull(forest, "forest must not be null");
    this.offset = offset;
  }

  @Override
  public double scoreSamples(double[] scaledRow) {
    double raw;
    // RandomCutForest is not thread-safe
    synchronized (forest) {
      raw = forest.getAnomalyScore(scaledRow);
    }
    return -raw / (1.0 + raw);
  }

  @Override
  public double offset() {
    return offset;
  }

  RandomCutForest forest() {
    return forest;
  }

  public int dimensions() {
    return forest.getDimensions();
  }

  public int numberOfTrees() {
    return forest.getNumberOfTrees();
  }
}
