package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionPayload;
import io.paysync.billing.service.SubscriptionSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Creates or refreshes the subscription and grants the features of its price. */
@Component
@Order(10)
@RequiredArgsConstructor
public class SubscriptionCreatedHandler implements BillingEventHandler {

  private final ProviderPayloadReader payloadReader;
  private final SubscriptionSyncService syncService;

  @Override
  public String eventType() {
    return BillingEventTypes.SUBSCRIPTION_CREATED;
  }

  @Override
  public void handle(JsonNode payload) {
    syncService.applyCreated(payloadReader.read(payload, SubscriptionPayload.class));
  }
}
