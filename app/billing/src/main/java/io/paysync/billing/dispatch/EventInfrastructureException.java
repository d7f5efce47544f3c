package io.paysync.billing.dispatch;

import java.util.Map;

/** Connectivity or backend failure; always retried. */
public class EventInfrastructureException extends EventRetryException {

  private static final long serialVersionUID = 1L;
  public static final String KEY = "event@infrastructure";

  public EventInfrastructureException(String message, Throwable cause) {
    this(message, Map.of(), cause);
  }

  public EventInfrastructureException(
      String message, Map<String, Object> context, Throwable cause) {
    super(message, KEY, context, cause);
  }
}
