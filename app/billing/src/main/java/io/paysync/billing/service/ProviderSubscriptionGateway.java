/*
 * Where: billing service layer
 * What: read access to the payment provider's current view of a subscription
 * Why: webhook payloads can lack period data, and stale rows need a fresh snapshot
 */
package io.paysync.billing.service;

import io.paysync.billing.handler.payload.SubscriptionPayload;
import java.util.Optional;

public interface ProviderSubscriptionGateway {

  /** Empty when the provider is not reachable from this deployment or does not know the id. */
  Optional<SubscriptionPayload> fetchSubscription(String externalSubscriptionId);
}
