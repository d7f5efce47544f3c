/*
 * Where: billing event dispatch
 * What: transient condition worth another attempt, e.g. a referenced row not synced yet
 * Why: out-of-order deliveries resolve by retrying the later event
 */
package io.paysync.billing.dispatch;

import java.util.Map;

public class EventRetryException extends HandlerFailureException {

  private static final long serialVersionUID = 1L;
  public static final String KEY = "event@retry";

  public EventRetryException(String message) {
    this(message, Map.of());
  }

  public EventRetryException(String message, Map<String, Object> context) {
    super(message, KEY, context, null);
  }

  protected EventRetryException(
      String message, String key, Map<String, Object> context, Throwable cause) {
    super(message, key, context, cause);
  }

  @Override
  public boolean expected() {
    return false;
  }

  @Override
  public boolean retryable() {
    return true;
  }
}
