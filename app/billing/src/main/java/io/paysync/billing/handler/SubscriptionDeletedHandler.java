package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionPayload;
import io.paysync.billing.service.SubscriptionSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Cancels the subscription and revokes everything it granted. */
@Component
@Order(30)
@RequiredArgsConstructor
public class SubscriptionDeletedHandler implements BillingEventHandler {

  private final ProviderPayloadReader payloadReader;
  private final SubscriptionSyncService syncService;

  @Override
  public String eventType() {
    return BillingEventTypes.SUBSCRIPTION_DELETED;
  }

  @Override
  public void handle(JsonNode payload) {
    syncService.applyDeleted(payloadReader.read(payload, SubscriptionPayload.class));
  }
}
