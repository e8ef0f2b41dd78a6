package com.farewatch.ml.model;

public record HealthResponse(String status, int modelsLoaded, String database, String redis) {}
