package com.flamingo.ai.docrag.exception;

/**
 * Base class for all pipeline failures.
 *
 * <p>Carries an {@link ErrorKind} so callers can branch on the category without inspecting the
 * concrete type, and a message that is safe to show to API clients.
 */
public abstract class DocRagException extends RuntimeException {

  private final ErrorKind kind;
  private final String userMessage;

  protected DocRagException(ErrorKind kind, String message, String userMessage) {
    super(message);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  protected DocRagException(ErrorKind kind, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
