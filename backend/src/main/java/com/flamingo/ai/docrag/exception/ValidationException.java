package com.flamingo.ai.docrag.exception;

/** Exception thrown when a request or record fails validation. */
public class ValidationException extends DocRagException {

  public ValidationException(String message) {
    super(ErrorKind.VALIDATION, message, message);
  }
}
