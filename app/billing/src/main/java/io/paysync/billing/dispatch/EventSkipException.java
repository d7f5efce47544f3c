/*
 * Where: billing event dispatch
 * What: "this event cannot and should not be applied"
 * Why: the event is marked processed; use this instead of a silent return so the no-op is auditable
 */
package io.paysync.billing.dispatch;

import java.util.Map;

public class EventSkipException extends HandlerFailureException {

  private static final long serialVersionUID = 1L;
  public static final String KEY = "event@skipped";

  public EventSkipException(String message) {
    this(message, Map.of());
  }

  public EventSkipException(String message, Map<String, Object> context) {
    super(message, KEY, context, null);
  }

  public EventSkipException(String message, Map<String, Object> context, Throwable cause) {
    super(message, KEY, context, cause);
  }

  @Override
  public boolean expected() {
    return true;
  }

  @Override
  public boolean retryable() {
    return false;
  }
}
