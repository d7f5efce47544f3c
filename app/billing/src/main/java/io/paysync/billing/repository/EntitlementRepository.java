/*
 * Where: billing data access
 * What: entitlement grant/revoke/usage persistence
 * Why: rows are soft-revoked and reactivated in place, keeping usage counters and audit history
 */
package io.paysync.billing.repository;

import static io.paysync.common.JdbcTimestampUtils.toInstant;
import static io.paysync.common.JdbcTimestampUtils.toTimestamp;

import io.paysync.billing.model.EntitlementRecord;
import io.paysync.billing.model.EntitlementSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EntitlementRepository {

  private static final String COLUMNS =
      """
      id, customer_id, feature, granted_by, subscription_id, is_active, granted_at,
      expires_at, revoked_at, revoke_reason, usage_limit, usage_count
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Set<String> findActiveFeaturesForSubscription(long subscriptionId) {
    final String sql =
        """
        SELECT feature FROM entitlements
        WHERE subscription_id = :subscriptionId
          AND is_active = TRUE
        ORDER BY feature
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriptionId", subscriptionId);
    return new LinkedHashSet<>(jdbcTemplate.queryForList(sql, params, String.class));
  }

  /**
   * Grants the feature, or reactivates the revoked row for the same (customer, feature,
   * subscription). An already active row is left untouched.
   *
   * @return the granted row, or empty when it was already active
   */
  public Optional<EntitlementRecord> upsertGrantIfNotActive(
      long customerId,
      String feature,
      EntitlementSource grantedBy,
      Long subscriptionId,
      Instant expiresAt,
      Integer usageLimit,
      Instant now) {
    final String sql =
        """
        INSERT INTO entitlements (
          customer_id,
          feature,
          granted_by,
          subscription_id,
          is_active,
          granted_at,
          expires_at,
          usage_limit,
          usage_count,
          created_at,
          updated_at
        ) VALUES (
          :customerId,
          :feature,
          :grantedBy,
          :subscriptionId,
          TRUE,
          :now,
          :expiresAt,
          :usageLimit,
          0,
          :now,
          :now
        )
        ON CONFLICT ON CONSTRAINT uq_entitlement_per_subscription
        DO UPDATE SET
          is_active = TRUE,
          granted_by = EXCLUDED.granted_by,
          granted_at = EXCLUDED.granted_at,
          expires_at = EXCLUDED.expires_at,
          usage_limit = EXCLUDED.usage_limit,
          revoked_at = NULL,
          revoke_reason = NULL,
          updated_at = EXCLUDED.updated_at
        WHERE entitlements.is_active = FALSE
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("feature", feature)
            .addValue("grantedBy", grantedBy.dbValue())
            .addValue("subscriptionId", subscriptionId, Types.BIGINT)
            .addValue("expiresAt", toTimestamp(expiresAt), Types.TIMESTAMP)
            .addValue("usageLimit", usageLimit, Types.INTEGER)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int revokeFeaturesForSubscription(
      long subscriptionId, Collection<String> features, String reason, Instant now) {
    if (features.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE entitlements
        SET is_active = FALSE,
            revoked_at = :now,
            revoke_reason = :reason,
            updated_at = :now
        WHERE subscription_id = :subscriptionId
          AND feature IN (:features)
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("reason", reason)
            .addValue("subscriptionId", subscriptionId)
            .addValue("features", List.copyOf(features));
    return jdbcTemplate.update(sql, params);
  }

  public int revokeAllForSubscription(long subscriptionId, String reason, Instant now) {
    final String sql =
        """
        UPDATE entitlements
        SET is_active = FALSE,
            revoked_at = :now,
            revoke_reason = :reason,
            updated_at = :now
        WHERE subscription_id = :subscriptionId
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("reason", reason)
            .addValue("subscriptionId", subscriptionId);
    return jdbcTemplate.update(sql, params);
  }

  /** Revokes every active row for the feature, whichever source granted it. */
  public int revokeFeatureForCustomer(long customerId, String feature, String reason, Instant now) {
    final String sql =
        """
        UPDATE entitlements
        SET is_active = FALSE,
            revoked_at = :now,
            revoke_reason = :reason,
            updated_at = :now
        WHERE customer_id = :customerId
          AND feature = :feature
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("reason", reason)
            .addValue("customerId", customerId)
            .addValue("feature", feature);
    return jdbcTemplate.update(sql, params);
  }

  public boolean existsUsable(long customerId, String feature, Instant now) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM entitlements
          WHERE customer_id = :customerId
            AND feature = :feature
            AND is_active = TRUE
            AND (expires_at IS NULL OR expires_at > :now)
            AND (usage_limit IS NULL OR usage_count < usage_limit)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("feature", feature)
            .addValue("now", toTimestamp(now));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /** Usage limits are not applied here; a feature with exhausted usage is still held. */
  public List<String> findActiveFeatures(long customerId, Instant now) {
    final String sql =
        """
        SELECT DISTINCT feature FROM entitlements
        WHERE customer_id = :customerId
          AND is_active = TRUE
          AND (expires_at IS NULL OR expires_at > :now)
        ORDER BY feature
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  public List<EntitlementRecord> findByCustomer(long customerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM entitlements
            WHERE customer_id = :customerId
            ORDER BY feature, id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", customerId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Consumes one unit from a usable row. The limit check and the increment are one statement, so
   * concurrent callers cannot overshoot the limit.
   */
  public int incrementUsage(long customerId, String feature, Instant now) {
    final String sql =
        """
        UPDATE entitlements
        SET usage_count = usage_count + 1,
            updated_at = :now
        WHERE id = (
          SELECT id FROM entitlements
          WHERE customer_id = :customerId
            AND feature = :feature
            AND is_active = TRUE
            AND (expires_at IS NULL OR expires_at > :now)
            AND (usage_limit IS NULL OR usage_count < usage_limit)
          ORDER BY id
          LIMIT 1
          FOR UPDATE
        )
          AND (usage_limit IS NULL OR usage_count < usage_limit)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("customerId", customerId)
            .addValue("feature", feature);
    return jdbcTemplate.update(sql, params);
  }

  private EntitlementRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long subscriptionId = rs.getLong("subscription_id");
    final Long subscriptionRef = rs.wasNull() ? null : subscriptionId;
    final int usageLimit = rs.getInt("usage_limit");
    final Integer usageLimitRef = rs.wasNull() ? null : usageLimit;
    return new EntitlementRecord(
        rs.getLong("id"),
        rs.getLong("customer_id"),
        rs.getString("feature"),
        EntitlementSource.fromDbValue(rs.getString("granted_by")),
        subscriptionRef,
        rs.getBoolean("is_active"),
        toInstant(rs.getTimestamp("granted_at")),
        toInstant(rs.getTimestamp("expires_at")),
        toInstant(rs.getTimestamp("revoked_at")),
        rs.getString("revoke_reason"),
        usageLimitRef,
        rs.getInt("usage_count"));
  }
}
