/*
 * Where: billing event dispatch
 * What: base type for failures a handler raises on purpose
 * Why: the task boundary decides retry vs terminal from the type alone, never from the message
 */
package io.paysync.billing.dispatch;

import java.util.Map;

public abstract class HandlerFailureException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String key;
  private final transient Map<String, Object> context;

  protected HandlerFailureException(
      String message, String key, Map<String, Object> context, Throwable cause) {
    super(message, cause);
    this.key = key;
    this.context = context == null ? Map.of() : Map.copyOf(context);
  }

  public String key() {
    return key;
  }

  public Map<String, Object> context() {
    return context;
  }

  /** True when the failure is a normal business outcome rather than a fault. */
  public abstract boolean expected();

  public abstract boolean retryable();
}
