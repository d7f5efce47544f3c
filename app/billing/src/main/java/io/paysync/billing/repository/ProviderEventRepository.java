/*
 * Where: billing data access
 * What: provider_events ingestion, lease-based claiming and outcome bookkeeping
 * Why: the event store is the durable queue between the inbound boundary and tracked dispatch
 */
package io.paysync.billing.repository;

import static io.paysync.common.JdbcTimestampUtils.toInstant;
import static io.paysync.common.JdbcTimestampUtils.toTimestamp;

import io.paysync.billing.model.ProviderEventRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ProviderEventRepository {

  private static final String RETURNING_COLUMNS =
      """
      RETURNING e.id, e.external_id, e.event_type, e.payload::text AS payload_text,
                e.trace_id, e.received_at, e.attempt_count
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ProviderEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs EI_EXPOSE_REP2: keep our own wrapper instead of the shared reference
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  /**
   * Inserts the event unless its external id is already stored.
   *
   * @return the new row id, or empty when another delivery got there first
   */
  public Optional<Long> insertIfAbsent(
      String externalId, String eventType, String payloadJson, String traceId, Instant receivedAt) {
    final String sql =
        """
        INSERT INTO provider_events (
          external_id,
          event_type,
          payload,
          trace_id,
          received_at,
          fully_processed,
          attempt_count
        ) VALUES (
          :externalId,
          :eventType,
          :payload::jsonb,
          :traceId,
          :receivedAt,
          FALSE,
          0
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("eventType", eventType)
            .addValue("payload", payloadJson)
            .addValue("traceId", traceId)
            .addValue("receivedAt", toTimestamp(receivedAt));
    try {
      return Optional.ofNullable(jdbcTemplate.queryForObject(sql, params, Long.class));
    } catch (DuplicateKeyException ex) {
      return Optional.empty();
    }
  }

  public Optional<Long> findIdByExternalId(String externalId) {
    final String sql = "SELECT id FROM provider_events WHERE external_id = :externalId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("externalId", externalId);
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }

  /**
   * A redelivery of an event that is still unprocessed makes it due immediately. An exhausted
   * event gets a fresh attempt budget because the provider is retrying it on its own schedule.
   */
  public int rearmUnprocessed(String externalId, Instant now) {
    final String sql =
        """
        UPDATE provider_events
        SET next_attempt_at = :now,
            attempt_count = CASE WHEN exhausted_at IS NULL THEN attempt_count ELSE 0 END,
            exhausted_at = NULL
        WHERE external_id = :externalId
          AND fully_processed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<ProviderEventRecord> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // lease-expired rows are reclaimed, so a crashed worker only delays its batch
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM provider_events
          WHERE fully_processed = FALSE
            AND exhausted_at IS NULL
            AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
            AND (lease_until IS NULL OR lease_until <= :now)
          ORDER BY received_at, id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE provider_events e
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        FROM cte
        WHERE e.id = cte.id
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Claims one event regardless of its retry schedule; used for direct re-dispatch. */
  public Optional<ProviderEventRecord> claimById(
      long eventId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM provider_events
          WHERE id = :eventId
            AND fully_processed = FALSE
            AND exhausted_at IS NULL
            AND (lease_until IS NULL OR lease_until <= :now)
          FOR UPDATE SKIP LOCKED
        )
        UPDATE provider_events e
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        FROM cte
        WHERE e.id = cte.id
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Restarts the lease of one claimed event right before it is dispatched, so a long batch never
   * works on rows whose batch-wide lease already ran out.
   *
   * @return 0 when the lease expired or another worker holds the row
   */
  public int renewLease(long eventId, String lockedBy, Instant now, Instant leaseUntil) {
    final String sql =
        """
        UPDATE provider_events
        SET lease_until = :leaseUntil
        WHERE id = :eventId
          AND locked_by = :lockedBy
          AND lease_until > :now
          AND fully_processed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markProcessed(long eventId, String lockedBy, int attemptCount, Instant processedAt) {
    final String sql =
        """
        UPDATE provider_events
        SET fully_processed = TRUE,
            processed_at = :processedAt,
            attempt_count = :attemptCount,
            next_attempt_at = NULL,
            locked_by = NULL,
            lease_until = NULL
        WHERE id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("processedAt", toTimestamp(processedAt))
            .addValue("attemptCount", attemptCount)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      long eventId, String lockedBy, int attemptCount, Instant nextAttemptAt, String lastError) {
    final String sql =
        """
        UPDATE provider_events
        SET attempt_count = :attemptCount,
            next_attempt_at = :nextAttemptAt,
            last_error = :lastError,
            locked_by = NULL,
            lease_until = NULL
        WHERE id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** Exhausted events stay unprocessed for operator triage; only a redelivery re-arms them. */
  public int markExhausted(
      long eventId, String lockedBy, int attemptCount, Instant exhaustedAt, String lastError) {
    final String sql =
        """
        UPDATE provider_events
        SET attempt_count = :attemptCount,
            next_attempt_at = NULL,
            exhausted_at = :exhaustedAt,
            last_error = :lastError,
            locked_by = NULL,
            lease_until = NULL
        WHERE id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("exhaustedAt", toTimestamp(exhaustedAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteProcessedOlderThan(Instant threshold) {
    // unprocessed events are never purged, whatever their age
    final String sql =
        """
        DELETE FROM provider_events
        WHERE fully_processed = TRUE
          AND processed_at <= :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countExhausted() {
    final String sql =
        """
        SELECT COUNT(*) FROM provider_events
        WHERE fully_processed = FALSE
          AND exhausted_at IS NOT NULL
        """;
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private ProviderEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProviderEventRecord(
        rs.getLong("id"),
        rs.getString("external_id"),
        rs.getString("event_type"),
        rs.getString("payload_text"),
        rs.getString("trace_id"),
        toInstant(rs.getTimestamp("received_at")),
        rs.getInt("attempt_count"));
  }
}
