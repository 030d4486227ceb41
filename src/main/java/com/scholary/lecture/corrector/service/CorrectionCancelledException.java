package com.scholary.lecture.corrector.service;

/** Thrown when a run is interrupted between segments. Nothing of the run is written. */
public class CorrectionCancelledException extends RuntimeException {

  public CorrectionCancelledException(String message) {
    super(message);
  }
}
