/*
 * Where: billing event dispatch
 * What: immutable event type to ordered handler list table
 * Why: registration is finished before the dispatcher becomes reachable, so reads need no locking
 */
package io.paysync.billing.dispatch;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HandlerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);

  private final ImmutableListMultimap<String, BillingEventHandler> handlers;

  private HandlerRegistry(ImmutableListMultimap<String, BillingEventHandler> handlers) {
    this.handlers = handlers;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Zero handlers is a warning only: providers deliver informational events nobody consumes. */
  public List<BillingEventHandler> handlersFor(String eventType) {
    final ImmutableList<BillingEventHandler> resolved = handlers.get(eventType);
    if (resolved.isEmpty()) {
      logger.warn("no handlers registered eventType={}", eventType);
    }
    return resolved;
  }

  public Set<String> eventTypes() {
    return ImmutableSet.copyOf(handlers.keySet());
  }

  public int size() {
    return handlers.size();
  }

  public static final class Builder {

    private final ImmutableListMultimap.Builder<String, BillingEventHandler> entries =
        ImmutableListMultimap.builder();
    private final SetMultimap<String, String> registeredNames = HashMultimap.create();

    private Builder() {}

    public Builder register(String eventType, BillingEventHandler handler) {
      if (eventType == null || eventType.isBlank()) {
        throw new IllegalArgumentException("eventType must not be blank");
      }
      if (handler == null) {
        throw new IllegalArgumentException("handler must not be null eventType=" + eventType);
      }
      final String name = handler.name();
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("handler name must not be blank eventType=" + eventType);
      }
      if (!registeredNames.put(eventType, name)) {
        throw new IllegalStateException(
            "handler already registered eventType=" + eventType + " name=" + name);
      }
      entries.put(eventType, handler);
      return this;
    }

    public Builder register(BillingEventHandler handler) {
      if (handler == null) {
        throw new IllegalArgumentException("handler must not be null");
      }
      return register(handler.eventType(), handler);
    }

    public HandlerRegistry build() {
      return new HandlerRegistry(entries.build());
    }
  }
}
