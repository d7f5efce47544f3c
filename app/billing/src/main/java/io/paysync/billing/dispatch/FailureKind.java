package io.paysync.billing.dispatch;

public enum FailureKind {
  SKIP,
  RETRY,
  INFRASTRUCTURE,
  /** Anything not raised on purpose; retried, but it points at a gap in handler code. */
  UNCLASSIFIED;

  public boolean retryable() {
    return this != SKIP;
  }
}
