package com.farewatch.ml.repo;

/**
 * Row shape of {@link PriceHistoryRepository#findTrainingRows}. Dates come back as ISO
 * strings and the observation time as epoch millis so no driver-specific temporal types leak.
 */
public interface TrainingRowView {
  String getRouteId();
  Number getPrice();
  String getDepartureDate();
  String getReturnDate();
  Number getObservedAtMillis();
  Number getAvgPrice30d();
  Number getStdPrice30d();
  Number getMinPrice90d();
  Number getMaxPrice90d();
  Boolean getIsAnomaly();
}
