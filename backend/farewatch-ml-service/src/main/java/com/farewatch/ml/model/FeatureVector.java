package com.farewatch.ml.model;

/**
 * Feature contract shared by training and scoring.
 *
 * <p>The detector consumes the first seven fields (see {@link #toModelInput()});
 * {@code recentTrend} is carried on the contract but never fed to the model, so the
 * training path (where it is always 0) and the scoring path stay consistent.
 */
public record FeatureVector(
    double priceRatio,
    double zScore,
    int dayOfWeek,
    long daysUntilDeparture,
    long tripDuration,
    double seasonalFactor,
    double priceVariance,
    double recentTrend
) {

  public static final int MODEL_FEATURE_COUNT = 7;

  public static final String[] MODEL_FEATURE_NAMES = {
      "price_ratio",
      "z_score",
      "day_of_week",
      "days_until_departure",
      "trip_duration",
      "seasonal_factor",
      "price_variance"
  };

  /**
   * Detector input row. Non-finite values (NaN, infinities from a zero average) become 0.
   */
  public double[] toModelInput() {
    return new double[] {
        finiteOrZero(priceRatio),
        finiteOrZero(zScore),
        dayOfWeek,
        daysUntilDeparture,
        tripDuration,
        finiteOrZero(seasonalFactor),
        finiteOrZero(priceVariance)
    };
  }

  public boolean isFinite() {
    return Double.isFinite(priceRatio)
        && Double.isFinite(zScore)
        && Double.isFinite(seasonalFactor)
        && Double.isFinite(priceVariance)
        && Double.isFinite(recentTrend);
  }

  private static double finiteOrZero(double v) {
    return Double.isFinite(v) ? v : 0.0;
  }
}
