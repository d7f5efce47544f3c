/*
 * Where: billing event dispatch
 * What: resolves handlers for an event type and runs them, untracked or with per-handler completion
 * Why: one event fans out to handlers with different side effects; a retry must only re-run the
 *      handlers that did not finish
 */
package io.paysync.billing.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.repository.HandlerCompletionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class EventDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

  private final HandlerRegistry registry;
  private final HandlerCompletionRepository completionRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public EventDispatcher(
      HandlerRegistry registry,
      HandlerCompletionRepository completionRepository,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.registry = registry;
    this.completionRepository = completionRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Runs every handler for the type in registration order. Failures propagate and stop the pass.
   *
   * @return number of handlers invoked
   */
  public int dispatch(String eventType, JsonNode payload) {
    final List<BillingEventHandler> handlers = registry.handlersFor(eventType);
    for (BillingEventHandler handler : handlers) {
      logger.info("dispatching eventType={} handler={}", eventType, handler.name());
      if (handler.runsInTransaction()) {
        transactionTemplate.executeWithoutResult(status -> handler.handle(payload));
      } else {
        handler.handle(payload);
      }
    }
    return handlers.size();
  }

  /**
   * Runs the handlers that have not completed for this event yet. A transactional handler locks
   * its completion row, re-checks it and commits its effects together with the completion mark,
   * so two overlapping dispatches of one event apply it once. A failing handler leaves its row
   * incomplete and the remaining handlers are not invoked in this pass.
   *
   * @return number of handlers invoked, excluding the ones skipped as already completed
   */
  public int dispatchTracked(long eventId, String eventType, JsonNode payload) {
    final List<BillingEventHandler> handlers = registry.handlersFor(eventType);
    int invoked = 0;
    for (BillingEventHandler handler : handlers) {
      final String handlerName = handler.name();
      completionRepository.ensureExists(eventId, handlerName, Instant.now(clock));
      final boolean ran =
          handler.runsInTransaction()
              ? runLocked(eventId, eventType, handler, payload)
              : runUnlocked(eventId, eventType, handler, payload);
      if (ran) {
        invoked++;
      }
    }
    return invoked;
  }

  private boolean runLocked(
      long eventId, String eventType, BillingEventHandler handler, JsonNode payload) {
    final String handlerName = handler.name();
    final Boolean ran =
        transactionTemplate.execute(
            status -> {
              if (completionRepository.lockCompleted(eventId, handlerName)) {
                logAlreadyCompleted(eventId, eventType, handlerName);
                return Boolean.FALSE;
              }
              logger.info(
                  "dispatching eventId={} eventType={} handler={}",
                  eventId,
                  eventType,
                  handlerName);
              handler.handle(payload);
              if (completionRepository.markCompleted(eventId, handlerName, Instant.now(clock))
                  == 0) {
                throw new IllegalStateException(
                    "handler completion row vanished eventId="
                        + eventId
                        + " handler="
                        + handlerName);
              }
              return Boolean.TRUE;
            });
    return Boolean.TRUE.equals(ran);
  }

  // non-transactional handlers are at-least-once; they must tolerate a repeated call
  private boolean runUnlocked(
      long eventId, String eventType, BillingEventHandler handler, JsonNode payload) {
    final String handlerName = handler.name();
    if (completionRepository.isCompleted(eventId, handlerName)) {
      logAlreadyCompleted(eventId, eventType, handlerName);
      return false;
    }
    logger.info(
        "dispatching eventId={} eventType={} handler={}", eventId, eventType, handlerName);
    handler.handle(payload);
    if (completionRepository.markCompleted(eventId, handlerName, Instant.now(clock)) == 0) {
      logger.warn(
          "handler completed concurrently eventId={} eventType={} handler={}",
          eventId,
          eventType,
          handlerName);
    }
    return true;
  }

  private void logAlreadyCompleted(long eventId, String eventType, String handlerName) {
    logger.info(
        "handler already completed eventId={} eventType={} handler={}",
        eventId,
        eventType,
        handlerName);
  }
}
