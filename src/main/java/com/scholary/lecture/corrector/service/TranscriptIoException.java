package com.scholary.lecture.corrector.service;

/** Exception thrown when a transcript or statistics file cannot be read or written. */
public class TranscriptIoException extends RuntimeException {

  public TranscriptIoException(String message) {
    super(message);
  }

  public TranscriptIoException(String message, Throwable cause) {
    super(message, cause);
  }
}
