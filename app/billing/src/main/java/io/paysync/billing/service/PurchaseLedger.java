/*
 * Where: billing service layer
 * What: refund and dispute bookkeeping on recorded purchases
 * Why: refunds are applied as a single capped increment so amount_refunded never exceeds amount
 */
package io.paysync.billing.service;

import io.paysync.billing.model.PurchaseRecord;
import io.paysync.billing.repository.PurchaseRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PurchaseLedger {

  private static final Logger logger = LoggerFactory.getLogger(PurchaseLedger.class);

  private final PurchaseRepository purchaseRepository;
  private final Clock clock;

  /**
   * Refunds {@code amount}, or the full remaining amount when null.
   *
   * @throws IllegalArgumentException when the amount is not positive or the purchase does not exist
   */
  @Transactional
  public PurchaseRecord refund(long purchaseId, BigDecimal amount) {
    if (amount != null && amount.signum() <= 0) {
      throw new IllegalArgumentException("refund amount must be positive");
    }
    final PurchaseRecord refunded =
        purchaseRepository
            .applyRefund(purchaseId, amount, Instant.now(clock))
            .orElseThrow(
                () -> new IllegalArgumentException("purchase not found purchaseId=" + purchaseId));
    logger.info(
        "purchase refunded purchaseId={} requested={} amountRefunded={} status={}",
        purchaseId,
        amount == null ? "full" : amount.toPlainString(),
        refunded.amountRefunded().toPlainString(),
        refunded.status().dbValue());
    return refunded;
  }

  @Transactional
  public void markDisputed(long purchaseId, String reason) {
    final int updated = purchaseRepository.markDisputed(purchaseId, reason, Instant.now(clock));
    if (updated == 0) {
      throw new IllegalArgumentException("purchase not found purchaseId=" + purchaseId);
    }
    logger.warn("purchase disputed purchaseId={} reason={}", purchaseId, reason);
  }
}
