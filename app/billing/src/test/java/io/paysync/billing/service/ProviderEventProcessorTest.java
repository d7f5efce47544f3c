/*
 * Where: provider event processing tests
 * What: skip terminality, bounded retries and per-handler completion across attempts
 * Why: a retried event must never re-apply the handlers that already committed
 */
package io.paysync.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import io.paysync.billing.AbstractPostgresContainerTest;
import io.paysync.billing.BillingTables;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.paysync.billing.config.BillingEventsProperties;
import io.paysync.billing.dispatch.EventDispatcher;
import io.paysync.billing.repository.HandlerCompletionRepository;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
@Import(RecordingHandlers.class)
class ProviderEventProcessorTest extends AbstractPostgresContainerTest {

  @Autowired private ProviderEventProcessor processor;
  @Autowired private EventIngestionService ingestionService;
  @Autowired private HandlerCompletionRepository completionRepository;
  @Autowired private EventDispatcher dispatcher;
  @Autowired private BillingEventsProperties eventsProperties;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    BillingTables.clear(jdbcTemplate);
    RecordingHandlers.COUNTERS.reset();
  }

  @Test
  void skippedEventIsProcessedAndNeverRetried() {
    final long eventId = ingest("evt_skip", RecordingHandlers.SKIP);

    assertThat(processor.process(eventId)).isTrue();
    assertThat(processor.process(eventId)).isFalse();

    final Map<String, Object> row = row(eventId);
    assertThat(row.get("fully_processed")).isEqualTo(true);
    assertThat(row.get("attempt_count")).isEqualTo(1);
    assertThat(RecordingHandlers.COUNTERS.skip.get()).isOne();
  }

  @Test
  void retryingEventStopsAfterMaxAttempts() {
    final long eventId = ingest("evt_retry", RecordingHandlers.RETRY);

    int passes = 0;
    while (processor.process(eventId)) {
      passes++;
    }

    final int maxAttempts = eventsProperties.maxAttempts();
    assertThat(passes).isEqualTo(maxAttempts);
    assertThat(RecordingHandlers.COUNTERS.retry.get()).isEqualTo(maxAttempts);
    final Map<String, Object> row = row(eventId);
    assertThat(row.get("fully_processed")).isEqualTo(false);
    assertThat(row.get("exhausted_at")).isNotNull();
    assertThat(row.get("attempt_count")).isEqualTo(maxAttempts);
    assertThat((String) row.get("last_error")).contains("dependency not ready");
  }

  @Test
  void retryIsScheduledInTheFuture() {
    final long eventId = ingest("evt_retry_once", RecordingHandlers.RETRY);

    processor.process(eventId);

    assertThat(processor.processDueBatch()).isZero();
    final Map<String, Object> row = row(eventId);
    assertThat(row.get("next_attempt_at")).isNotNull();
    assertThat(row.get("attempt_count")).isEqualTo(1);
  }

  @Test
  void unclassifiedFailureIsRetriedWithError() {
    final long eventId = ingest("evt_bug", RecordingHandlers.UNCLASSIFIED);

    processor.process(eventId);

    final Map<String, Object> row = row(eventId);
    assertThat(row.get("fully_processed")).isEqualTo(false);
    assertThat(row.get("exhausted_at")).isNull();
    assertThat((String) row.get("last_error")).contains("bug in handler");
  }

  @Test
  void completedHandlerIsNotRerunOnRetry() {
    RecordingHandlers.COUNTERS.secondStepFailures.set(1);
    final long eventId = ingest("evt_two_step", RecordingHandlers.TWO_STEP);

    processor.process(eventId);

    assertThat(completionRepository.isCompleted(eventId, "ledger-step")).isTrue();
    assertThat(completionRepository.isCompleted(eventId, "notify-step")).isFalse();

    processor.process(eventId);

    assertThat(RecordingHandlers.COUNTERS.firstStep.get()).isOne();
    assertThat(RecordingHandlers.COUNTERS.secondStep.get()).isEqualTo(2);
    assertThat(completionRepository.isCompleted(eventId, "notify-step")).isTrue();
    assertThat(row(eventId).get("fully_processed")).isEqualTo(true);
  }

  @Test
  void eventWithoutHandlersIsProcessed() {
    final long eventId = ingest("evt_unknown", "customer.tax_id.created");

    assertThat(processor.processDueBatch()).isOne();
    assertThat(row(eventId).get("fully_processed")).isEqualTo(true);
  }

  @Test
  void processDueBatchPicksUpPendingEvents() {
    ingest("evt_a", RecordingHandlers.TWO_STEP);
    ingest("evt_b", RecordingHandlers.SKIP);

    assertThat(processor.processDueBatch()).isEqualTo(2);
    assertThat(processor.processDueBatch()).isZero();
    assertThat(BillingTables.count(
            jdbcTemplate, "SELECT COUNT(*) FROM provider_events WHERE fully_processed = TRUE"))
        .isEqualTo(2);
  }

  @Test
  void overlappingTrackedDispatchesApplyHandlerOnce() throws Exception {
    final long eventId = ingest("evt_gated", RecordingHandlers.GATED);
    final JsonNode payload = JsonNodeFactory.instance.objectNode().put("id", "ch_1");
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final Future<Integer> first =
          executor.submit(
              () -> dispatcher.dispatchTracked(eventId, RecordingHandlers.GATED, payload));
      assertThat(RecordingHandlers.COUNTERS.gatedEntered.await(10, TimeUnit.SECONDS)).isTrue();

      final Future<Integer> second =
          executor.submit(
              () -> dispatcher.dispatchTracked(eventId, RecordingHandlers.GATED, payload));
      awaitBlockedOnRowLock();
      RecordingHandlers.COUNTERS.gatedRelease.countDown();

      assertThat(first.get(10, TimeUnit.SECONDS)).isOne();
      assertThat(second.get(10, TimeUnit.SECONDS)).isZero();
      assertThat(RecordingHandlers.COUNTERS.gated.get()).isOne();
      assertThat(completionRepository.isCompleted(eventId, "gated-ledger")).isTrue();
    } finally {
      RecordingHandlers.COUNTERS.gatedRelease.countDown();
      executor.shutdownNow();
    }
  }

  private void awaitBlockedOnRowLock() throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (System.nanoTime() < deadline) {
      final int waiting =
          BillingTables.count(
              jdbcTemplate,
              """
              SELECT COUNT(*) FROM pg_stat_activity
              WHERE datname = current_database()
                AND wait_event_type = 'Lock'
              """);
      if (waiting > 0) {
        return;
      }
      Thread.sleep(20);
    }
    fail("second dispatch never waited on the completion row lock");
  }

  private long ingest(String externalId, String eventType) {
    return ingestionService.ingest(externalId, eventType, "{\"id\":\"obj_1\"}", "trace-1").eventId();
  }

  private Map<String, Object> row(long eventId) {
    return jdbcTemplate.queryForMap(
        "SELECT * FROM provider_events WHERE id = :id", new MapSqlParameterSource("id", eventId));
  }
}
