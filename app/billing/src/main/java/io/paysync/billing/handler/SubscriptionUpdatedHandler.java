package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionPayload;
import io.paysync.billing.service.SubscriptionSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Copies the provider snapshot and converges entitlements with the new status. */
@Component
@Order(20)
@RequiredArgsConstructor
public class SubscriptionUpdatedHandler implements BillingEventHandler {

  private final ProviderPayloadReader payloadReader;
  private final SubscriptionSyncService syncService;

  @Override
  public String eventType() {
    return BillingEventTypes.SUBSCRIPTION_UPDATED;
  }

  @Override
  public void handle(JsonNode payload) {
    syncService.applyUpdated(payloadReader.read(payload, SubscriptionPayload.class));
  }
}
