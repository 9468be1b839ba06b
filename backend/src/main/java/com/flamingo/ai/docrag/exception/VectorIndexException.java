package com.flamingo.ai.docrag.exception;

/** Exception thrown when the vector index is unavailable or rejects an operation. */
public class VectorIndexException extends DocRagException {

  public VectorIndexException(String message) {
    super(ErrorKind.INDEX, message, "Search is temporarily unavailable. Please try again.");
  }

  public VectorIndexException(String message, Throwable cause) {
    super(ErrorKind.INDEX, message, "Search is temporarily unavailable. Please try again.", cause);
  }
}
