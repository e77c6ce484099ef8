package com.flamingo.ai.sectionranker.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String COLLECTION_NOT_FOUND = "COLLECTION_001";
  public static final String TASK_MALFORMED = "TASK_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_001";
  public static final String EMBEDDING_FAILED = "EMBEDDING_001";
  public static final String OUTPUT_WRITE_FAILED = "OUTPUT_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
