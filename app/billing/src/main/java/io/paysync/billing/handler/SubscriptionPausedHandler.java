package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionPayload;
import io.paysync.billing.service.SubscriptionSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Pauses the subscription; access is revoked until it resumes. */
@Component
@Order(40)
@RequiredArgsConstructor
public class SubscriptionPausedHandler implements BillingEventHandler {

  private final ProviderPayloadReader payloadReader;
  private final SubscriptionSyncService syncService;

  @Override
  public String eventType() {
    return BillingEventTypes.SUBSCRIPTION_PAUSED;
  }

  @Override
  public void handle(JsonNode payload) {
    syncService.applyPaused(payloadReader.read(payload, SubscriptionPayload.class));
  }
}
