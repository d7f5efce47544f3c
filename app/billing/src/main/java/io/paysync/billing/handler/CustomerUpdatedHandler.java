package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.CustomerPayload;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.model.CustomerRecord;
import io.paysync.billing.repository.CustomerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Keeps the local billing email in line with the provider's customer record. */
@Component
@Order(110)
@RequiredArgsConstructor
public class CustomerUpdatedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(CustomerUpdatedHandler.class);

  private final ProviderPayloadReader payloadReader;
  private final CustomerRepository customerRepository;
  private final Clock clock;

  @Override
  public String eventType() {
    return BillingEventTypes.CUSTOMER_UPDATED;
  }

  @Override
  public void handle(JsonNode payload) {
    final CustomerPayload update = payloadReader.read(payload, CustomerPayload.class);
    final CustomerRecord customer =
        customerRepository
            .findByExternalId(update.id())
            .orElseThrow(
                () ->
                    new EventSkipException(
                        "customer update for unknown customer",
                        Map.of("external_customer_id", String.valueOf(update.id()))));
    if (update.email() == null || Objects.equals(customer.billingEmail(), update.email())) {
      return;
    }
    customerRepository.updateBillingEmail(customer.id(), update.email(), Instant.now(clock));
    logger.info("customer billing email updated customerId={}", customer.id());
  }
}
