package com.farewatch.ml.model;

public record LabeledSample(FeatureVector features, boolean anomaly) {}
