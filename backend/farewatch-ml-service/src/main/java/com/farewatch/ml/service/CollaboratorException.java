package com.farewatch.ml.service;

/**
 * A storage collaborator (model files, cache) could not be reached or failed mid-operation.
 */
public class CollaboratorException extends RuntimeException {

  public CollaboratorException(String message, Throwable cause) {
    super(message, cause);
  }
}
