package com.farewatch.ml.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record DetectRequest(@NotNull @Valid Features features, String modelId) {

  public record Features(
      @NotNull Double priceRatio,
      @NotNull Double zScore,
      @NotNull @Min(0) @Max(6) Integer dayOfWeek,
      @NotNull Long daysUntilDeparture,
      @NotNull @Min(0) Long tripDuration,
      @NotNull Double seasonalFactor,
      @NotNull Double priceVariance,
      @NotNull Double recentTrend
  ) {

    @AssertTrue(message = "feature values must be finite numbers")
    public boolean isAllFinite() {
      return isFiniteOrAbsent(priceRatio)
          && isFiniteOrAbsent(zScore)
          && isFiniteOrAbsent(seasonalFactor)
          && isFiniteOrAbsent(priceVariance)
          && isFiniteOrAbsent(recentTrend);
    }

    public FeatureVector toFeatureVector() {
      return new FeatureVector(priceRatio, zScore, dayOfWeek, daysUntilDeparture, tripDuration,
          seasonalFactor, priceVariance, recentTrend);
    }

    // null is reported by @NotNull
    private static boolean isFiniteOrAbsent(Double v) {
      return v == null || Double.isFinite(v);
    }
  }
}
