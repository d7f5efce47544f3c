package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.ChargePayload;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.model.PurchaseRecord;
import io.paysync.billing.repository.PurchaseRepository;
import io.paysync.billing.service.PurchaseLedger;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Records the part of a charge's cumulative refund that the ledger has not seen yet. The new amount
 * is spread over the invoice's purchases in line order, each capped at its net amount.
 */
@Component
@Order(80)
@RequiredArgsConstructor
public class ChargeRefundedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(ChargeRefundedHandler.class);

  private final ProviderPayloadReader payloadReader;
  private final PurchaseRepository purchaseRepository;
  private final PurchaseLedger purchaseLedger;

  @Override
  public String eventType() {
    return BillingEventTypes.CHARGE_REFUNDED;
  }

  @Override
  public void handle(JsonNode payload) {
    final ChargePayload charge = payloadReader.read(payload, ChargePayload.class);
    if (charge.invoice() == null) {
      throw new EventSkipException(
          "refunded charge has no invoice", Map.of("charge_id", String.valueOf(charge.id())));
    }
    if (charge.amountRefunded() <= 0) {
      throw new EventSkipException(
          "refunded charge carries no refunded amount",
          Map.of("charge_id", String.valueOf(charge.id())));
    }
    final List<PurchaseRecord> purchases = purchaseRepository.lockByInvoiceId(charge.invoice());
    if (purchases.isEmpty()) {
      throw new EventSkipException(
          "no purchases for refunded invoice", Map.of("external_invoice_id", charge.invoice()));
    }
    final BigDecimal recorded =
        purchases.stream()
            .map(PurchaseRecord::amountRefunded)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    final BigDecimal unrecorded = charge.amountRefundedValue().subtract(recorded);
    if (unrecorded.signum() <= 0) {
      throw new EventSkipException(
          "charge refund already recorded",
          Map.of(
              "charge_id", String.valueOf(charge.id()),
              "external_invoice_id", charge.invoice()));
    }
    BigDecimal remaining = unrecorded;
    for (PurchaseRecord purchase : purchases) {
      if (remaining.signum() <= 0) {
        break;
      }
      final BigDecimal share = remaining.min(purchase.netAmount());
      if (share.signum() > 0) {
        purchaseLedger.refund(purchase.id(), share);
        remaining = remaining.subtract(share);
      }
    }
    logger.info(
        "charge refund applied chargeId={} invoiceId={} purchases={} amountRefunded={} applied={}",
        charge.id(),
        charge.invoice(),
        purchases.size(),
        charge.amountRefundedValue().toPlainString(),
        unrecorded.subtract(remaining).toPlainString());
  }
}
