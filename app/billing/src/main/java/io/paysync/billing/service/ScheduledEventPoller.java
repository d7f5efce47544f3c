/*
 * Where: billing service layer
 * What: claims due scheduled events and dispatches them untracked
 * Why: reminders and expirations are time-driven; several instances must split the backlog safely
 */
package io.paysync.billing.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paysync.billing.config.ScheduledEventProperties;
import io.paysync.billing.dispatch.EventDispatcher;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.dispatch.FailureClassifier;
import io.paysync.billing.dispatch.FailureKind;
import io.paysync.billing.model.ScheduledEventRecord;
import io.paysync.billing.repository.ScheduledEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduledEventPoller {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledEventPoller.class);

  private final ScheduledEventRepository scheduledEventRepository;
  private final EventDispatcher dispatcher;
  private final ScheduledEventProperties properties;
  private final BillingMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** @return number of rows claimed by this run */
  public int pollOnce() {
    final Instant now = Instant.now(clock);
    final String lockedBy = WorkerIdentity.resolveLockedBy();
    final List<ScheduledEventRecord> claimed =
        scheduledEventRepository.claimDue(
            properties.batchSize(),
            properties.maxAttempts(),
            now,
            now.plus(properties.lease()),
            lockedBy);
    for (ScheduledEventRecord record : claimed) {
      processOne(record, lockedBy);
    }
    if (!claimed.isEmpty()) {
      logger.info("scheduled events polled claimed={}", claimed.size());
    }
    return claimed.size();
  }

  private void processOne(ScheduledEventRecord record, String lockedBy) {
    MDC.put("scheduled_event_id", String.valueOf(record.id()));
    MDC.put("event_type", record.eventType());
    try {
      final Instant now = Instant.now(clock);
      if (scheduledEventRepository.renewLease(
              record.id(), lockedBy, now, now.plus(properties.lease()))
          == 0) {
        metrics.recordScheduledOutcome("lease_lost");
        logger.warn(
            "scheduled event lease lost before dispatch id={} eventType={}",
            record.id(),
            record.eventType());
        return;
      }
      dispatcher.dispatch(record.eventType(), parsePayload(record));
      markProcessed(record, lockedBy, "processed");
    } catch (RuntimeException ex) {
      handleFailure(record, ex, lockedBy);
    } finally {
      MDC.remove("scheduled_event_id");
      MDC.remove("event_type");
    }
  }

  private void handleFailure(ScheduledEventRecord record, RuntimeException ex, String lockedBy) {
    final FailureKind kind = FailureClassifier.classify(ex);
    if (kind == FailureKind.SKIP) {
      logger.info(
          "scheduled event skipped id={} eventType={} reason={}",
          record.id(),
          record.eventType(),
          ex.getMessage());
      markProcessed(record, lockedBy, "skipped");
      return;
    }
    final int attempts = record.attempts() + 1;
    final String lastError =
        WorkerIdentity.truncateError(ex, properties.errorMessageMaxLength());
    final int updated = scheduledEventRepository.markFailed(record.id(), lockedBy, lastError);
    if (updated == 0) {
      logger.warn(
          "scheduled event failure not recorded because lock was lost id={} attempt={}",
          record.id(),
          attempts);
      return;
    }
    if (attempts >= properties.maxAttempts()) {
      metrics.recordScheduledOutcome("exhausted");
      logger.error(
          "scheduled event exhausted id={} eventType={} attempts={} kind={}",
          record.id(),
          record.eventType(),
          attempts,
          kind,
          ex);
      return;
    }
    metrics.recordScheduledOutcome("failed");
    if (kind == FailureKind.UNCLASSIFIED) {
      logger.error(
          "scheduled event failed id={} eventType={} attempt={}",
          record.id(),
          record.eventType(),
          attempts,
          ex);
    } else {
      logger.warn(
          "scheduled event failed id={} eventType={} attempt={} kind={} reason={}",
          record.id(),
          record.eventType(),
          attempts,
          kind,
          ex.getMessage());
    }
  }

  private void markProcessed(ScheduledEventRecord record, String lockedBy, String outcome) {
    final int updated =
        scheduledEventRepository.markProcessed(record.id(), lockedBy, Instant.now(clock));
    if (updated == 0) {
      logger.warn("scheduled event processed but lock was lost id={}", record.id());
      return;
    }
    metrics.recordScheduledOutcome(outcome);
  }

  private JsonNode parsePayload(ScheduledEventRecord record) {
    try {
      return objectMapper.readTree(record.payloadJson());
    } catch (JsonProcessingException ex) {
      throw new EventSkipException(
          "scheduled payload is not valid JSON", Map.of("scheduled_event_id", record.id()), ex);
    }
  }
}
