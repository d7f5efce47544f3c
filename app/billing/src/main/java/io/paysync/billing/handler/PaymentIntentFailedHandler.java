package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.handler.payload.PaymentIntentPayload;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Audit only; dunning is driven by the provider's subscription status updates. */
@Component
@Order(100)
@RequiredArgsConstructor
public class PaymentIntentFailedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(PaymentIntentFailedHandler.class);

  private final ProviderPayloadReader payloadReader;

  @Override
  public String eventType() {
    return BillingEventTypes.PAYMENT_INTENT_FAILED;
  }

  @Override
  public boolean runsInTransaction() {
    return false;
  }

  @Override
  public void handle(JsonNode payload) {
    final PaymentIntentPayload intent = payloadReader.read(payload, PaymentIntentPayload.class);
    logger.warn(
        "payment failed paymentIntentId={} customer={} amount={}",
        intent.id(),
        intent.customer(),
        intent.amountValue().toPlainString());
  }
}
