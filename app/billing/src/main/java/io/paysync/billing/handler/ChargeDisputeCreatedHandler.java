package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.DisputePayload;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.model.PurchaseRecord;
import io.paysync.billing.repository.PurchaseRepository;
import io.paysync.billing.service.PurchaseLedger;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(90)
@RequiredArgsConstructor
public class ChargeDisputeCreatedHandler implements BillingEventHandler {

  private final ProviderPayloadReader payloadReader;
  private final PurchaseRepository purchaseRepository;
  private final PurchaseLedger purchaseLedger;

  @Override
  public String eventType() {
    return BillingEventTypes.CHARGE_DISPUTE_CREATED;
  }

  @Override
  public void handle(JsonNode payload) {
    final DisputePayload dispute = payloadReader.read(payload, DisputePayload.class);
    final PurchaseRecord purchase =
        findByCharge(dispute.charge())
            .or(() -> findByPaymentIntent(dispute.paymentIntent()))
            .orElseThrow(
                () ->
                    new EventSkipException(
                        "no purchase for disputed charge",
                        Map.of(
                            "dispute_id", String.valueOf(dispute.id()),
                            "charge_id", String.valueOf(dispute.charge()),
                            "payment_intent_id", String.valueOf(dispute.paymentIntent()))));
    purchaseLedger.markDisputed(purchase.id(), dispute.reason());
  }

  private Optional<PurchaseRecord> findByCharge(String chargeId) {
    return chargeId == null ? Optional.empty() : purchaseRepository.findFirstByChargeId(chargeId);
  }

  private Optional<PurchaseRecord> findByPaymentIntent(String paymentIntentId) {
    return paymentIntentId == null
        ? Optional.empty()
        : purchaseRepository.findFirstByPaymentIntentId(paymentIntentId);
  }
}
