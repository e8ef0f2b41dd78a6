package com.farewatch.ml.model;

import java.time.Instant;

public record ModelDeletedResponse(String message, String routeId, Instant timestamp) {}
