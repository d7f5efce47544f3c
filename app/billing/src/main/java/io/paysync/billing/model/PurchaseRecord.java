/*
 * Where: billing domain model
 * What: snapshot of one purchases row
 * Why: refund and dispute handlers read the ledger state they just updated atomically
 */
package io.paysync.billing.model;

import java.math.BigDecimal;

public record PurchaseRecord(
    long id,
    long customerId,
    PurchaseType purchaseType,
    PurchaseStatus status,
    BigDecimal amount,
    BigDecimal amountRefunded,
    String productName,
    String externalInvoiceId,
    String externalPriceId,
    String externalCheckoutSessionId,
    String externalChargeId,
    String externalPaymentIntentId,
    String disputeReason) {

  public BigDecimal netAmount() {
    return amount.subtract(amountRefunded);
  }
}
