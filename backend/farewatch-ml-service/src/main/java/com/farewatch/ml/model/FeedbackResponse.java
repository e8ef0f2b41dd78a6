package com.farewatch.ml.model;

public record FeedbackResponse(String status, String message) {}
