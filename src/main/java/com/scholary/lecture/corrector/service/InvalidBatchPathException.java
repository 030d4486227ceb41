package com.scholary.lecture.corrector.service;

/** Exception thrown when a batch directory lies outside the configured batch root. */
public class InvalidBatchPathException extends RuntimeException {

  public InvalidBatchPathException(String message) {
    super(message);
  }
}
