package com.farewatch.ml.service;

/**
 * No trained model could be resolved for a scoring request.
 */
public class ModelUnavailableException extends RuntimeException {

  public ModelUnavailableException(String message) {
    super(message);
  }
}
