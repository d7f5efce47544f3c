package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionPayload;
import io.paysync.billing.service.SubscriptionSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Reactivates a paused subscription and re-grants its price features. */
@Component
@Order(50)
@RequiredArgsConstructor
public class SubscriptionResumedHandler implements BillingEventHandler {

  private final ProviderPayloadReader payloadReader;
  private final SubscriptionSyncService syncService;

  @Override
  public String eventType() {
    return BillingEventTypes.SUBSCRIPTION_RESUMED;
  }

  @Override
  public void handle(JsonNode payload) {
    syncService.applyResumed(payloadReader.read(payload, SubscriptionPayload.class));
  }
}
