/*
 * Where: billing data access
 * What: subscriptions upsert, row-locked reads and lifecycle queries
 * Why: handlers lock the row for the whole dispatch transaction so rapid deliveries serialize
 */
package io.paysync.billing.repository;

import static io.paysync.common.JdbcTimestampUtils.toInstant;
import static io.paysync.common.JdbcTimestampUtils.toTimestamp;

import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.model.SubscriptionStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class SubscriptionRepository {

  private static final String COLUMNS =
      """
      id, customer_id, external_subscription_id, price_id, status,
      current_period_start, current_period_end, cancel_at_period_end, canceled_at,
      trial_start, trial_end, paused_at, resumed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public record UpsertResult(SubscriptionRecord subscription, boolean created) {}

  public UpsertResult upsert(SubscriptionRecord subscription, Instant now) {
    // xmax = 0 only for a freshly inserted tuple
    final String sql =
        """
        INSERT INTO subscriptions (
          customer_id,
          external_subscription_id,
          price_id,
          status,
          current_period_start,
          current_period_end,
          cancel_at_period_end,
          trial_start,
          trial_end,
          created_at,
          updated_at
        ) VALUES (
          :customerId,
          :externalSubscriptionId,
          :priceId,
          :status,
          :currentPeriodStart,
          :currentPeriodEnd,
          :cancelAtPeriodEnd,
          :trialStart,
          :trialEnd,
          :now,
          :now
        )
        ON CONFLICT (external_subscription_id)
        DO UPDATE SET
          customer_id = EXCLUDED.customer_id,
          price_id = EXCLUDED.price_id,
          status = EXCLUDED.status,
          current_period_start = EXCLUDED.current_period_start,
          current_period_end = EXCLUDED.current_period_end,
          cancel_at_period_end = EXCLUDED.cancel_at_period_end,
          trial_start = EXCLUDED.trial_start,
          trial_end = EXCLUDED.trial_end,
          updated_at = EXCLUDED.updated_at
        RETURNING
        """
            + COLUMNS
            + ", (xmax = 0) AS inserted";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", subscription.customerId())
            .addValue("externalSubscriptionId", subscription.externalSubscriptionId())
            .addValue("priceId", subscription.priceId())
            .addValue("status", subscription.status().wireValue())
            .addValue("currentPeriodStart", toTimestamp(subscription.currentPeriodStart()))
            .addValue("currentPeriodEnd", toTimestamp(subscription.currentPeriodEnd()))
            .addValue("cancelAtPeriodEnd", subscription.cancelAtPeriodEnd())
            .addValue("trialStart", toTimestamp(subscription.trialStart()))
            .addValue("trialEnd", toTimestamp(subscription.trialEnd()))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(
        sql, params, (rs, rowNum) -> new UpsertResult(mapRow(rs, rowNum), rs.getBoolean("inserted")));
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<SubscriptionRecord> findByExternalIdForUpdate(String externalSubscriptionId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE external_subscription_id = :externalSubscriptionId
            FOR UPDATE
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("externalSubscriptionId", externalSubscriptionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<SubscriptionRecord> findByIdForUpdate(long subscriptionId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE id = :subscriptionId
            FOR UPDATE
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriptionId", subscriptionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<SubscriptionRecord> findByExternalId(String externalSubscriptionId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE external_subscription_id = :externalSubscriptionId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("externalSubscriptionId", externalSubscriptionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int update(SubscriptionRecord subscription, Instant now) {
    final String sql =
        """
        UPDATE subscriptions
        SET price_id = :priceId,
            status = :status,
            current_period_start = :currentPeriodStart,
            current_period_end = :currentPeriodEnd,
            cancel_at_period_end = :cancelAtPeriodEnd,
            canceled_at = :canceledAt,
            trial_start = :trialStart,
            trial_end = :trialEnd,
            paused_at = :pausedAt,
            resumed_at = :resumedAt,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("priceId", subscription.priceId())
            .addValue("status", subscription.status().wireValue())
            .addValue("currentPeriodStart", toTimestamp(subscription.currentPeriodStart()))
            .addValue("currentPeriodEnd", toTimestamp(subscription.currentPeriodEnd()))
            .addValue("cancelAtPeriodEnd", subscription.cancelAtPeriodEnd())
            .addValue("canceledAt", toTimestamp(subscription.canceledAt()))
            .addValue("trialStart", toTimestamp(subscription.trialStart()))
            .addValue("trialEnd", toTimestamp(subscription.trialEnd()))
            .addValue("pausedAt", toTimestamp(subscription.pausedAt()))
            .addValue("resumedAt", toTimestamp(subscription.resumedAt()))
            .addValue("now", toTimestamp(now))
            .addValue("id", subscription.id());
    return jdbcTemplate.update(sql, params);
  }

  /** Subscriptions set to cancel at period end whose period ends inside [from, to). */
  public List<SubscriptionRecord> findCancelingWithPeriodEndBetween(Instant from, Instant to) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE cancel_at_period_end = TRUE
              AND status IN ('active', 'trialing', 'past_due')
              AND current_period_end >= :from
              AND current_period_end < :to
            ORDER BY current_period_end, id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<SubscriptionRecord> findDelinquentWithPeriodEndBefore(Instant threshold) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE status IN ('past_due', 'unpaid')
              AND current_period_end < :threshold
            ORDER BY current_period_end, id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Access-granting subscriptions whose period ended before the threshold without an update. */
  public List<SubscriptionRecord> findStale(Instant threshold, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE status IN ('active', 'trialing', 'past_due')
              AND current_period_end < :threshold
            ORDER BY current_period_end, id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private SubscriptionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String status = rs.getString("status");
    return SubscriptionRecord.builder()
        .id(rs.getLong("id"))
        .customerId(rs.getLong("customer_id"))
        .externalSubscriptionId(rs.getString("external_subscription_id"))
        .priceId(rs.getString("price_id"))
        .status(
            SubscriptionStatus.fromWireValue(status)
                .orElseThrow(() -> new IllegalStateException("unknown stored status: " + status)))
        .currentPeriodStart(toInstant(rs.getTimestamp("current_period_start")))
        .currentPeriodEnd(toInstant(rs.getTimestamp("current_period_end")))
        .cancelAtPeriodEnd(rs.getBoolean("cancel_at_period_end"))
        .canceledAt(toInstant(rs.getTimestamp("canceled_at")))
        .trialStart(toInstant(rs.getTimestamp("trial_start")))
        .trialEnd(toInstant(rs.getTimestamp("trial_end")))
        .pausedAt(toInstant(rs.getTimestamp("paused_at")))
        .resumedAt(toInstant(rs.getTimestamp("resumed_at")))
        .build();
  }
}
