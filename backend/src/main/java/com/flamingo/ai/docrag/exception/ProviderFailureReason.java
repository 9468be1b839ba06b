package com.flamingo.ai.docrag.exception;

/** Classification of an embedding or generation provider failure. */
public enum ProviderFailureReason {
  RATE_LIMITED,
  TIMEOUT,
  FAILURE
}
