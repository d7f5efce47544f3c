package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.CheckoutSessionPayload;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.model.CustomerRecord;
import io.paysync.billing.repository.CustomerRepository;
import io.paysync.billing.repository.PurchaseRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Records paid one-time checkouts; subscription checkouts are covered by invoice.paid. */
@Component
@Order(70)
@RequiredArgsConstructor
public class CheckoutSessionCompletedHandler implements BillingEventHandler {

  private static final Logger logger =
      LoggerFactory.getLogger(CheckoutSessionCompletedHandler.class);

  static final String MODE_PAYMENT = "payment";
  static final String PAYMENT_STATUS_PAID = "paid";

  private final ProviderPayloadReader payloadReader;
  private final CustomerRepository customerRepository;
  private final PurchaseRepository purchaseRepository;
  private final Clock clock;

  @Override
  public String eventType() {
    return BillingEventTypes.CHECKOUT_SESSION_COMPLETED;
  }

  @Override
  public void handle(JsonNode payload) {
    final CheckoutSessionPayload session =
        payloadReader.read(payload, CheckoutSessionPayload.class);
    if (session.id() == null) {
      throw new EventSkipException("checkout session payload without id");
    }
    if (!MODE_PAYMENT.equals(session.mode())
        || !PAYMENT_STATUS_PAID.equals(session.paymentStatus())) {
      throw new EventSkipException(
          "checkout session is not a paid one-time payment",
          Map.of(
              "checkout_session_id", session.id(),
              "mode", String.valueOf(session.mode()),
              "payment_status", String.valueOf(session.paymentStatus())));
    }
    if (session.customer() == null) {
      throw new EventSkipException(
          "checkout session without customer", Map.of("checkout_session_id", session.id()));
    }
    final CustomerRecord customer =
        customerRepository
            .findByExternalId(session.customer())
            .orElseThrow(
                () ->
                    new EventSkipException(
                        "checkout session for unknown customer",
                        Map.of(
                            "checkout_session_id", session.id(),
                            "external_customer_id", session.customer())));
    final boolean inserted =
        purchaseRepository.insertCheckoutPurchaseIfAbsent(
            customer.id(),
            session.amountTotalValue(),
            session.productName(),
            session.id(),
            session.paymentIntent(),
            Instant.now(clock));
    if (!inserted) {
      logger.info("checkout purchase already recorded sessionId={}", session.id());
      return;
    }
    logger.info(
        "checkout purchase recorded sessionId={} customerId={} amount={} product={}",
        session.id(),
        customer.id(),
        session.amountTotalValue().toPlainString(),
        session.productName());
  }
}
