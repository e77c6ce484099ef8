package com.flamingo.ai.sectionranker.exception;

/** Exception thrown when the task input lacks a persona role or task statement. */
public class MalformedTaskDescriptorException extends RuntimeException {

  public MalformedTaskDescriptorException(String message) {
    super(message);
  }

  public MalformedTaskDescriptorException(String message, Throwable cause) {
    super(message, cause);
  }
}
