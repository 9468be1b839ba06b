package com.flamingo.ai.docrag.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_NOT_READY = "DOCUMENT_002";
  public static final String DOCUMENT_EMPTY = "DOCUMENT_003";
  public static final String PROVIDER_UNAVAILABLE = "PROVIDER_001";
  public static final String PROVIDER_RATE_LIMITED = "PROVIDER_002";
  public static final String INDEX_UNAVAILABLE = "INDEX_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
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
