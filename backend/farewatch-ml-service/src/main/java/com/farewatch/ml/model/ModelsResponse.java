package com.farewatch.ml.model;

import java.time.Instant;
import java.util.List;

public record ModelsResponse(List<String> models, int total, Instant timestamp) {}
