package com.mk.fx.qa.dicom.load.cstore;

/**
 * Closed set of results a single storage attempt can produce.
 *
 * <p>Retry policy lives on the constant itself so callers never inspect error text to decide
 * whether an attempt may be repeated.
 */
public enum OutcomeKind {
  /** The server acknowledged the store with a success status. */
  SUCCESS(false, false),
  /** Connection refused, reset or association aborted before a response. */
  NETWORK_ERROR(true, true),
  /** No response within the per-call timeout. */
  TIMEOUT(true, true),
  /** The server answered but refused the operation (failure status, association rejected). */
  PROTOCOL_REJECTED(true, false);

  private final boolean failure;
  private final boolean retryable;

  OutcomeKind(boolean failure, boolean retryable) {
    this.failure = failure;
    this.retryable = retryable;
  }

  public boolean isFailure() {
    return failure;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
