/*
 * Where: billing data access
 * What: purchase ledger writes keyed on provider invoice lines and checkout sessions
 * Why: refunds are applied as one capped increment so concurrent partial refunds cannot overshoot
 */
package io.paysync.billing.repository;

import static io.paysync.common.JdbcTimestampUtils.toTimestamp;

import io.paysync.billing.model.PurchaseRecord;
import io.paysync.billing.model.PurchaseStatus;
import io.paysync.billing.model.PurchaseType;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PurchaseRepository {

  private static final String COLUMNS =
      """
      id, customer_id, purchase_type, status, amount, amount_refunded, product_name,
      external_invoice_id, external_price_id, external_checkout_session_id,
      external_charge_id, external_payment_intent_id, dispute_reason
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public record InvoiceLinePurchase(
      long customerId,
      PurchaseType purchaseType,
      BigDecimal amount,
      String productName,
      String invoiceId,
      String priceId,
      String chargeId,
      String paymentIntentId) {}

  public PurchaseRecord upsertInvoiceLine(InvoiceLinePurchase line, Instant now) {
    final String sql =
        """
        INSERT INTO purchases (
          customer_id,
          purchase_type,
          status,
          amount,
          amount_refunded,
          product_name,
          external_invoice_id,
          external_price_id,
          external_charge_id,
          external_payment_intent_id,
          created_at,
          updated_at
        ) VALUES (
          :customerId,
          :purchaseType,
          'paid',
          :amount,
          0,
          :productName,
          :invoiceId,
          :priceId,
          :chargeId,
          :paymentIntentId,
          :now,
          :now
        )
        ON CONFLICT (external_invoice_id, external_price_id)
        DO UPDATE SET
          customer_id = EXCLUDED.customer_id,
          purchase_type = EXCLUDED.purchase_type,
          amount = GREATEST(EXCLUDED.amount, purchases.amount_refunded),
          product_name = EXCLUDED.product_name,
          external_charge_id = COALESCE(EXCLUDED.external_charge_id, purchases.external_charge_id),
          external_payment_intent_id =
            COALESCE(EXCLUDED.external_payment_intent_id, purchases.external_payment_intent_id),
          updated_at = EXCLUDED.updated_at
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", line.customerId())
            .addValue("purchaseType", line.purchaseType().dbValue())
            .addValue("amount", line.amount())
            .addValue("productName", line.productName())
            .addValue("invoiceId", line.invoiceId())
            .addValue("priceId", line.priceId() == null ? "" : line.priceId())
            .addValue("chargeId", line.chargeId(), Types.VARCHAR)
            .addValue("paymentIntentId", line.paymentIntentId(), Types.VARCHAR)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  /** @return false when the checkout session already produced a purchase */
  public boolean insertCheckoutPurchaseIfAbsent(
      long customerId,
      BigDecimal amount,
      String productName,
      String checkoutSessionId,
      String paymentIntentId,
      Instant now) {
    final String sql =
        """
        INSERT INTO purchases (
          customer_id,
          purchase_type,
          status,
          amount,
          amount_refunded,
          product_name,
          external_checkout_session_id,
          external_payment_intent_id,
          created_at,
          updated_at
        ) VALUES (
          :customerId,
          :purchaseType,
          'paid',
          :amount,
          0,
          :productName,
          :checkoutSessionId,
          :paymentIntentId,
          :now,
          :now
        )
        ON CONFLICT (external_checkout_session_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("purchaseType", PurchaseType.ONE_TIME.dbValue())
            .addValue("amount", amount)
            .addValue("productName", productName)
            .addValue("checkoutSessionId", checkoutSessionId)
            .addValue("paymentIntentId", paymentIntentId, Types.VARCHAR)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<PurchaseRecord> findById(long purchaseId) {
    final String sql = "SELECT " + COLUMNS + " FROM purchases WHERE id = :purchaseId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("purchaseId", purchaseId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<PurchaseRecord> findByInvoiceId(String invoiceId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM purchases WHERE external_invoice_id = :invoiceId ORDER BY id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("invoiceId", invoiceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Same rows as {@link #findByInvoiceId}, locked until the caller's transaction ends. */
  public List<PurchaseRecord> lockByInvoiceId(String invoiceId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM purchases WHERE external_invoice_id = :invoiceId ORDER BY id FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("invoiceId", invoiceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<PurchaseRecord> findFirstByChargeId(String chargeId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM purchases WHERE external_charge_id = :chargeId ORDER BY id LIMIT 1";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("chargeId", chargeId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<PurchaseRecord> findFirstByPaymentIntentId(String paymentIntentId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM purchases WHERE external_payment_intent_id = :paymentIntentId"
            + " ORDER BY id LIMIT 1";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("paymentIntentId", paymentIntentId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Adds {@code amount} (null means the full amount) to amount_refunded, capped at the purchase
   * amount, and derives the refund status from the capped total.
   */
  public Optional<PurchaseRecord> applyRefund(long purchaseId, BigDecimal amount, Instant now) {
    final String sql =
        """
        UPDATE purchases
        SET amount_refunded =
              LEAST(amount, amount_refunded + COALESCE(CAST(:amount AS NUMERIC), amount)),
            status = CASE
              WHEN LEAST(amount, amount_refunded + COALESCE(CAST(:amount AS NUMERIC), amount))
                   >= amount THEN 'refunded'
              ELSE 'partially_refunded'
            END,
            updated_at = :now
        WHERE id = :purchaseId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("amount", amount, Types.NUMERIC)
            .addValue("now", toTimestamp(now))
            .addValue("purchaseId", purchaseId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markDisputed(long purchaseId, String reason, Instant now) {
    final String sql =
        """
        UPDATE purchases
        SET status = :status,
            dispute_reason = :reason,
            updated_at = :now
        WHERE id = :purchaseId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", PurchaseStatus.DISPUTED.dbValue())
            .addValue("reason", reason, Types.VARCHAR)
            .addValue("now", toTimestamp(now))
            .addValue("purchaseId", purchaseId);
    return jdbcTemplate.update(sql, params);
  }

  private PurchaseRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PurchaseRecord(
        rs.getLong("id"),
        rs.getLong("customer_id"),
        PurchaseType.fromDbValue(rs.getString("purchase_type")),
        PurchaseStatus.fromDbValue(rs.getString("status")),
        rs.getBigDecimal("amount"),
        rs.getBigDecimal("amount_refunded"),
        rs.getString("product_name"),
        rs.getString("external_invoice_id"),
        rs.getString("external_price_id"),
        rs.getString("external_checkout_session_id"),
        rs.getString("external_charge_id"),
        rs.getString("external_payment_intent_id"),
        rs.getString("dispute_reason"));
  }
}
