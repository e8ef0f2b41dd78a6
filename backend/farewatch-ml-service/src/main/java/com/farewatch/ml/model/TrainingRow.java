package com.farewatch.ml.model;

/**
 * A historical observation joined with its rolling statistics and its review label.
 * {@code anomaly} is true when a detected or verified anomaly record exists for it.
 */
public record TrainingRow(PriceObservation observation, RouteStatistics statistics, boolean anomaly) {}
