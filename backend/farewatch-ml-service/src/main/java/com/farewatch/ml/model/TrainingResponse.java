package com.farewatch.ml.model;

import java.util.List;

public record TrainingResponse(String status, String message, List<TrainingOutcome> outcomes) {}
