/*
 * Where: billing service layer
 * What: claims stored provider events, runs tracked dispatch and applies the failure verdict
 * Why: this is the only layer that knows the retry budget; handlers just raise typed failures
 */
package io.paysync.billing.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.paysync.billing.config.BillingEventsProperties;
import io.paysync.billing.dispatch.EventDispatcher;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.dispatch.FailureClassifier;
import io.paysync.billing.dispatch.FailureKind;
import io.paysync.billing.dispatch.HandlerFailureException;
import io.paysync.billing.dispatch.RetryPolicy;
import io.paysync.billing.model.ProviderEventRecord;
import io.paysync.billing.repository.ProviderEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class ProviderEventProcessor {

  private static final Logger logger = LoggerFactory.getLogger(ProviderEventProcessor.class);

  private final ProviderEventRepository eventRepository;
  private final EventDispatcher dispatcher;
  private final BillingEventsProperties properties;
  private final BillingMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final RetryPolicy retryPolicy;

  public ProviderEventProcessor(
      ProviderEventRepository eventRepository,
      EventDispatcher dispatcher,
      BillingEventsProperties properties,
      BillingMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock) {
    this.eventRepository = eventRepository;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.retryPolicy = RetryPolicy.from(properties);
  }

  /** @return number of events claimed in this pass */
  public int processDueBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    // the claim commits on its own; handler work never runs under the claim's row locks
    final List<ProviderEventRecord> claimed =
        eventRepository.claimDue(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    for (ProviderEventRecord record : claimed) {
      processClaimed(record, lockedBy);
    }
    metrics.updateExhaustedCurrent(eventRepository.countExhausted());
    return claimed.size();
  }

  /**
   * Processes one event immediately, ignoring its retry schedule.
   *
   * @return false when the event is processed, exhausted, unknown or leased by another worker
   */
  public boolean process(long eventId) {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final Optional<ProviderEventRecord> claimed =
        eventRepository.claimById(eventId, now, now.plus(properties.lease()), lockedBy);
    if (claimed.isEmpty()) {
      logger.info("provider event not claimable eventId={}", eventId);
      return false;
    }
    processClaimed(claimed.get(), lockedBy);
    return true;
  }

  private void processClaimed(ProviderEventRecord record, String lockedBy) {
    MDC.put("event_id", String.valueOf(record.id()));
    MDC.put("event_type", record.eventType());
    if (record.traceId() != null) {
      MDC.put("trace_id", record.traceId());
    }
    try {
      if (!renewLease(record, lockedBy)) {
        return;
      }
      final JsonNode payload = parsePayload(record);
      final int invoked = dispatcher.dispatchTracked(record.id(), record.eventType(), payload);
      final int attempt = record.attemptCount() + 1;
      final int updated =
          eventRepository.markProcessed(record.id(), lockedBy, attempt, Instant.now(clock));
      if (updated == 0) {
        logger.warn(
            "provider event processed but lock was lost eventId={} attempt={}",
            record.id(),
            attempt);
        return;
      }
      metrics.recordEventOutcome("processed");
      logger.info(
          "provider event processed eventId={} eventType={} handlers={} attempt={}",
          record.id(),
          record.eventType(),
          invoked,
          attempt);
    } catch (RuntimeException ex) {
      handleFailure(record, ex, lockedBy);
    } finally {
      MDC.remove("event_id");
      MDC.remove("event_type");
      MDC.remove("trace_id");
    }
  }

  // the batch shares one lease; each event gets a full lease of its own before dispatch
  private boolean renewLease(ProviderEventRecord record, String lockedBy) {
    final Instant now = Instant.now(clock);
    final int renewed =
        eventRepository.renewLease(record.id(), lockedBy, now, now.plus(properties.lease()));
    if (renewed == 0) {
      metrics.recordEventOutcome("lease_lost");
      logger.warn(
          "provider event lease lost before dispatch eventId={} eventType={}",
          record.id(),
          record.eventType());
      return false;
    }
    return true;
  }

  private JsonNode parsePayload(ProviderEventRecord record) {
    try {
      return objectMapper.readTree(record.payloadJson());
    } catch (JsonProcessingException ex) {
      throw new EventSkipException(
          "stored payload is not valid JSON", Map.of("event_id", record.id()), ex);
    }
  }

  @VisibleForTesting
  void handleFailure(ProviderEventRecord record, RuntimeException ex, String lockedBy) {
    final FailureKind kind = FailureClassifier.classify(ex);
    final int attempt = record.attemptCount() + 1;
    final Instant now = Instant.now(clock);
    if (kind == FailureKind.SKIP) {
      final int updated = eventRepository.markProcessed(record.id(), lockedBy, attempt, now);
      if (updated == 0) {
        logger.warn("provider event skip lost its lock eventId={}", record.id());
        return;
      }
      metrics.recordEventOutcome("skipped");
      logger.info(
          "provider event skipped eventId={} eventType={} reason={} context={}",
          record.id(),
          record.eventType(),
          ex.getMessage(),
          contextOf(ex));
      return;
    }
    final String lastError = truncateError(ex);
    if (retryPolicy.isExhausted(attempt)) {
      final int updated =
          eventRepository.markExhausted(record.id(), lockedBy, attempt, now, lastError);
      if (updated == 0) {
        logger.warn(
            "provider event exhaustion skipped because lock was lost eventId={} attempt={}",
            record.id(),
            attempt);
        return;
      }
      metrics.recordEventOutcome("exhausted");
      logger.error(
          "provider event exhausted eventId={} eventType={} attempts={} kind={}",
          record.id(),
          record.eventType(),
          attempt,
          kind,
          ex);
      return;
    }
    final Duration delay = retryPolicy.delayAfter(attempt);
    final int updated =
        eventRepository.markRetry(record.id(), lockedBy, attempt, now.plus(delay), lastError);
    if (updated == 0) {
      logger.warn(
          "provider event retry skipped because lock was lost eventId={} attempt={}",
          record.id(),
          attempt);
      return;
    }
    metrics.recordEventOutcome(kind == FailureKind.UNCLASSIFIED ? "failed" : "retried");
    if (kind == FailureKind.UNCLASSIFIED) {
      logger.error(
          "provider event failed with unclassified error eventId={} eventType={} attempt={}"
              + " retryIn={}",
          record.id(),
          record.eventType(),
          attempt,
          delay,
          ex);
      return;
    }
    logger.warn(
        "provider event retry scheduled eventId={} eventType={} attempt={} kind={} retryIn={}"
            + " reason={} context={}",
        record.id(),
        record.eventType(),
        attempt,
        kind,
        delay,
        ex.getMessage(),
        contextOf(ex));
  }

  private static Map<String, Object> contextOf(Throwable failure) {
    if (failure instanceof HandlerFailureException handlerFailure) {
      return handlerFailure.context();
    }
    return Map.of();
  }

  @VisibleForTesting
  String truncateError(Throwable failure) {
    return WorkerIdentity.truncateError(failure, properties.errorMessageMaxLength());
  }

  @VisibleForTesting
  String resolveLockedBy() {
    return WorkerIdentity.resolveLockedBy();
  }
}
