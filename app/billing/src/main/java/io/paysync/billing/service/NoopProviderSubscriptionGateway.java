package io.paysync.billing.service;

import io.paysync.billing.handler.payload.SubscriptionPayload;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default gateway for deployments without provider API credentials. */
@Component
public class NoopProviderSubscriptionGateway implements ProviderSubscriptionGateway {

  private static final Logger logger =
      LoggerFactory.getLogger(NoopProviderSubscriptionGateway.class);

  @Override
  public Optional<SubscriptionPayload> fetchSubscription(String externalSubscriptionId) {
    logger.debug("provider fetch disabled externalSubscriptionId={}", externalSubscriptionId);
    return Optional.empty();
  }
}
