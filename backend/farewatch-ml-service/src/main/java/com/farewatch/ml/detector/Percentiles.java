package com.farewatch.ml.detector;

import java.util.Arrays;

final class Percentiles {

  private Percentiles() {
  }

  /**
   * Percentile with linear interpolation between closest ranks.
   *
   * @param q in [0, 100]
   */
  static double of(double[] values, double q) {
    if (values.length == 0) {
      throw new IllegalArgumentException("values must not be empty");
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double rank = (q / 100.0) * (sorted.length - 1);
    int lo = (int) Math.floor(rank);
    int hi = (int) Math.ceil(rank);
    if (lo == hi) {
      return sorted[lo];
    }
    return sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
  }
}
