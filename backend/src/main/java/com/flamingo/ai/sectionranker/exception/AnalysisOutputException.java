package com.flamingo.ai.sectionranker.exception;

/** Exception thrown when the analysis result cannot be written. */
public class AnalysisOutputException extends RuntimeException {

  public AnalysisOutputException(String message, Throwable cause) {
    super(message, cause);
  }
}
