package com.farewatch.ml.model;

/**
 * Rolling per-route aggregates over the observations preceding the one being scored.
 * {@code stdPrice30d} is null when fewer than two prior prices exist.
 */
public record RouteStatistics(
    Double avgPrice30d,
    Double stdPrice30d,
    Double minPrice90d,
    Double maxPrice90d
) {
  public boolean hasAverage() {
    return avgPrice30d != null;
  }
}
