package io.paysync.billing.repository;

import static io.paysync.common.JdbcTimestampUtils.toTimestamp;

import io.paysync.billing.model.CustomerRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CustomerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CustomerRecord> findByExternalId(String externalCustomerId) {
    final String sql =
        """
        SELECT id, external_customer_id, billing_email
        FROM customers
        WHERE external_customer_id = :externalCustomerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("externalCustomerId", externalCustomerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public CustomerRecord insert(String externalCustomerId, String billingEmail, Instant now) {
    final String sql =
        """
        INSERT INTO customers (external_customer_id, billing_email, created_at, updated_at)
        VALUES (:externalCustomerId, :billingEmail, :now, :now)
        RETURNING id, external_customer_id, billing_email
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("externalCustomerId", externalCustomerId)
            .addValue("billingEmail", billingEmail)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public int updateBillingEmail(long customerId, String billingEmail, Instant now) {
    final String sql =
        """
        UPDATE customers
        SET billing_email = :billingEmail,
            updated_at = :now
        WHERE id = :customerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("billingEmail", billingEmail)
            .addValue("now", toTimestamp(now))
            .addValue("customerId", customerId);
    return jdbcTemplate.update(sql, params);
  }

  private CustomerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CustomerRecord(
        rs.getLong("id"), rs.getString("external_customer_id"), rs.getString("billing_email"));
  }
}
