package com.farewatch.ml.scoring;

/**
 * What scoring does when the requested model id has no trained model.
 */
public enum FallbackPolicy {
  /** Serve the request with the global model; unavailable if that is untrained too. */
  FALLBACK_TO_GLOBAL,
  /** Fit and publish a model on synthetic data under the requested id, then serve it. */
  SYNTHESIZE_DEFAULT,
  /** Fail the request as unavailable. */
  REJECT
}
