package com.farewatch.ml.model;

import java.time.Instant;

public record ModelMetrics(
    String modelId,
    double contamination,
    int sampleCount,
    long detectedAnomalyCount,
    Instant trainedAt
) {}
