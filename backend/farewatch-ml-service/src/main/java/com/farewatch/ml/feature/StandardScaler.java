package com.farewatch.ml.feature;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-feature standardization (zero mean, unit variance), fitted once on a training matrix
 * and reapplied unchanged at scoring time. Features with no variance keep a scale of 1.
 *
 * <p>Instances are immutable; a fitted scaler can be shared across threads.
 */
public final class StandardScaler {

  private static final StandardScaler UNFITTED = new StandardScaler(null, null);

  private final double[] mean;
  private final double[] scale;

  private StandardScaler(double[] mean, double[] scale) {
    this.mean = mean;
    this.scale = scale;
  }

  public static StandardScaler unfitted() {
    return UNFITTED;
  }

  public static StandardScaler of(double[] mean, double[] scale) {
    Objects.requireNonNull(mean, "mean must not be null");
    Objects.requireNonNull(scale, "scale must not be null");
    if (mean.length != scale.length) {
      throw new IllegalArgumentException(
          "mean and scale lengths differ: " + mean.length + " vs " + scale.length);
    }
    return new StandardScaler(mean.clone(), scale.clone());
  }

  public static StandardScaler fit(double[][] rows) {
    Objects.requireNonNull(rows, "rows must not be null");
    if (rows.length == 0) {
      throw new IllegalArgumentException("cannot fit a scaler on an empty matrix");
    }
    int width = rows[0].length;
    int n = rows.length;

    double[] mean = new double[width];
    for (double[] row : rows) {
      for (int j = 0; j < width; j++) {
        mean[j] += row[j];
      }
    }
    for (int j = 0; j < width; j++) {
      mean[j] /= n;
    }

    // population variance, as the scaler is reapplied to single rows
    double[] scale = new double[width];
    for (double[] row : rows) {
      for (int j = 0; j < width; j++) {
        double d = row[j] - mean[j];
        scale[j] += d * d;
      }
    }
    for (int j = 0; j < width; j++) {
      double std = Math.sqrt(scale[j] / n);
      scale[j] = std > 0.0 ? std : 1.0;
    }
    return new StandardScaler(mean, scale);
  }

  public boolean isFitted() {
    return mean != null;
  }

  public int width() {
    requireFitted();
    return mean.length;
  }

  /**
   * @throws IllegalStateException if the scaler was never fitted
   */
  public double[] transform(double[] row) {
    requireFitted();
    if (row.length != mean.length) {
      throw new IllegalArgumentException(
          "expected " + mean.length + " features, got: " + row.length);
    }
    double[] out = new double[row.length];
    for (int j = 0; j < row.length; j++) {
      out[j] = (row[j] - mean[j]) / scale[j];
    }
    return out;
  }

  public double[][] transform(double[][] rows) {
    double[][] out = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      out[i] = transform(rows[i]);
    }
    return out;
  }

  public double[] mean() {
    requireFitted();
    return mean.clone();
  }

  public double[] scale() {
    requireFitted();
    return scale.clone();
  }

  private void requireFitted() {
    if (!isFitted()) {
      throw new IllegalStateException("StandardScaler has not been fitted");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StandardScaler that)) return false;
    return Arrays.equals(mean, that.mean) && Arrays.equals(scale, that.scale);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(mean) + Arrays.hashCode(scale);
  }
}
