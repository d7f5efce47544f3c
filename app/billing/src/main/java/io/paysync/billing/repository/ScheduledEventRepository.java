/*
 * Where: billing data access
 * What: scheduled_events creation and concurrent-safe claiming for the poller
 * Why: several poller instances split the due backlog without blocking each other
 */
package io.paysync.billing.repository;

import static io.paysync.common.JdbcTimestampUtils.toInstant;
import static io.paysync.common.JdbcTimestampUtils.toTimestamp;

import io.paysync.billing.model.ScheduledEventRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduledEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Creates the event unless one with the same dedup key exists. A null key never conflicts.
   *
   * @return true when a row was inserted
   */
  public boolean insertIfAbsent(
      String eventType, Instant executeAt, String payloadJson, String dedupKey, Instant createdAt) {
    final String sql =
        """
        INSERT INTO scheduled_events (
          event_type,
          execute_at,
          payload,
          dedup_key,
          processed,
          attempts,
          created_at
        ) VALUES (
          :eventType,
          :executeAt,
          :payload::jsonb,
          :dedupKey,
          FALSE,
          0,
          :createdAt
        )
        ON CONFLICT (dedup_key) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventType", eventType)
            .addValue("executeAt", toTimestamp(executeAt))
            .addValue("payload", payloadJson)
            .addValue("dedupKey", dedupKey)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<ScheduledEventRecord> claimDue(
      int limit, int maxAttempts, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM scheduled_events
          WHERE processed = FALSE
            AND execute_at <= :now
            AND attempts < :maxAttempts
            AND (lease_until IS NULL OR lease_until <= :now)
          ORDER BY execute_at, id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE scheduled_events s
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        FROM cte
        WHERE s.id = cte.id
        RETURNING s.id, s.event_type, s.execute_at, s.payload::text AS payload_text, s.attempts
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("maxAttempts", maxAttempts)
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** @return 0 when the lease expired or another worker holds the row */
  public int renewLease(long id, String lockedBy, Instant now, Instant leaseUntil) {
    final String sql =
        """
        UPDATE scheduled_events
        SET lease_until = :leaseUntil
        WHERE id = :id
          AND locked_by = :lockedBy
          AND lease_until > :now
          AND processed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markProcessed(long id, String lockedBy, Instant processedAt) {
    final String sql =
        """
        UPDATE scheduled_events
        SET processed = TRUE,
            processed_at = :processedAt,
            attempts = attempts + 1,
            locked_by = NULL,
            lease_until = NULL
        WHERE id = :id
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("processedAt", toTimestamp(processedAt))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(long id, String lockedBy, String lastError) {
    final String sql =
        """
        UPDATE scheduled_events
        SET attempts = attempts + 1,
            last_error = :lastError,
            locked_by = NULL,
            lease_until = NULL
        WHERE id = :id
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lastError", lastError)
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int countExhausted(int maxAttempts) {
    final String sql =
        """
        SELECT COUNT(*) FROM scheduled_events
        WHERE processed = FALSE
          AND attempts >= :maxAttempts
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("maxAttempts", maxAttempts), Integer.class);
    return count == null ? 0 : count;
  }

  private ScheduledEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduledEventRecord(
        rs.getLong("id"),
        rs.getString("event_type"),
        toInstant(rs.getTimestamp("execute_at")),
        rs.getString("payload_text"),
        rs.getInt("attempts"));
  }
}
