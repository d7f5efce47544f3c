/*
 * Where: billing event dispatch
 * What: one unit of logic bound to one event type
 * Why: handlers are plain beans; the registry wires them at startup before any dispatch
 */
package io.paysync.billing.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.ClassUtils;

public interface BillingEventHandler {

  String eventType();

  void handle(JsonNode payload);

  /**
   * When true the dispatcher runs the handler and its completion mark in one transaction. A
   * non-transactional handler may run again when two dispatches of its event overlap.
   */
  default boolean runsInTransaction() {
    return true;
  }

  /** Stable name used as the per-handler idempotency key; renaming a handler re-runs it. */
  default String name() {
    return ClassUtils.getUserClass(getClass()).getSimpleName();
  }
}
