package com.flamingo.ai.docrag.exception;

/** Exception thrown when the embedding or generation provider fails. */
public class ProviderException extends DocRagException {

  private final ProviderFailureReason reason;

  public ProviderException(ProviderFailureReason reason, String message) {
    super(ErrorKind.PROVIDER, message, userMessageFor(reason));
    this.reason = reason;
  }

  public ProviderException(ProviderFailureReason reason, String message, Throwable cause) {
    super(ErrorKind.PROVIDER, message, userMessageFor(reason), cause);
    this.reason = reason;
  }

  public ProviderFailureReason getReason() {
    return reason;
  }

  public boolean isRateLimited() {
    return reason == ProviderFailureReason.RATE_LIMITED;
  }

  private static String userMessageFor(ProviderFailureReason reason) {
    return reason == ProviderFailureReason.RATE_LIMITED
        ? "Service is temporarily busy. Please try again in a moment."
        : "AI service is temporarily unavailable. Please try again later.";
  }
}
