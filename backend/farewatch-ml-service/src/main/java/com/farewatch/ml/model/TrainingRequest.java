package com.farewatch.ml.model;

public record TrainingRequest(String routeId, boolean retrainAll) {}
