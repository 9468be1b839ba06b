package com.flamingo.ai.docrag.exception;

import org.springframework.http.HttpStatus;

/** Categories of failure surfaced by the ingestion and query pipelines. */
public enum ErrorKind {
  /** Malformed input: bad ids, wrong dimensionality, non-positive limits, unsupported files. */
  VALIDATION(ApiError.VALIDATION_ERROR, HttpStatus.BAD_REQUEST),

  /** Invalid chunking or pipeline parameters. */
  CONFIGURATION(ApiError.CONFIGURATION_ERROR, HttpStatus.INTERNAL_SERVER_ERROR),

  /** Embedding or generation provider failure after retries. */
  PROVIDER(ApiError.PROVIDER_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE),

  /** Vector index unreachable or rejected an operation. */
  INDEX(ApiError.INDEX_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE),

  /** Unknown document id. */
  NOT_FOUND(ApiError.DOCUMENT_NOT_FOUND, HttpStatus.NOT_FOUND),

  /** Document exists but is still processing or failed ingestion. */
  NOT_READY(ApiError.DOCUMENT_NOT_READY, HttpStatus.CONFLICT),

  /** Empty or whitespace-only document text. */
  DEGENERATE_INPUT(ApiError.DOCUMENT_EMPTY, HttpStatus.BAD_REQUEST),

  /** Unexpected failure outside the categories above. */
  INTERNAL(ApiError.INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final HttpStatus httpStatus;

  ErrorKind(String code, HttpStatus httpStatus) {
    this.code = code;
    this.httpStatus = httpStatus;
  }

  public String getCode() {
    return code;
  }

  public HttpStatus getHttpStatus() {
    return httpStatus;
  }
}
