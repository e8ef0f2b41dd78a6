package com.farewatch.ml.model;

public record MetricsResponse(String modelId, ModelMetrics metrics) {}
