/*
 * Where: billing data access
 * What: per (event, handler) completion rows for tracked dispatch
 * Why: a re-dispatch re-runs only the handlers that have not finished
 */
package io.paysync.billing.repository;

import static io.paysync.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class HandlerCompletionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void ensureExists(long eventId, String handlerName, Instant createdAt) {
    final String sql =
        """
        INSERT INTO handler_completions (event_id, handler_name, completed, created_at)
        VALUES (:eventId, :handlerName, FALSE, :createdAt)
        ON CONFLICT (event_id, handler_name) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("handlerName", handlerName)
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public boolean isCompleted(long eventId, String handlerName) {
    final String sql =
        """
        SELECT completed FROM handler_completions
        WHERE event_id = :eventId
          AND handler_name = :handlerName
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("handlerName", handlerName);
    return jdbcTemplate.queryForList(sql, params, Boolean.class).stream()
        .findFirst()
        .orElse(Boolean.FALSE);
  }

  /**
   * Reads the completion flag under a row lock. Must run inside the handler's transaction so a
   * concurrent dispatch of the same event waits here and then observes the committed flag.
   */
  public boolean lockCompleted(long eventId, String handlerName) {
    final String sql =
        """
        SELECT completed FROM handler_completions
        WHERE event_id = :eventId
          AND handler_name = :handlerName
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("handlerName", handlerName);
    return jdbcTemplate.queryForList(sql, params, Boolean.class).stream()
        .findFirst()
        .orElse(Boolean.FALSE);
  }

  public int markCompleted(long eventId, String handlerName, Instant completedAt) {
    final String sql =
        """
        UPDATE handler_completions
        SET completed = TRUE,
            completed_at = :completedAt
        WHERE event_id = :eventId
          AND handler_name = :handlerName
          AND completed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("eventId", eventId)
            .addValue("handlerName", handlerName);
    return jdbcTemplate.update(sql, params);
  }
}
