/*
 * Where: provider event handlers
 * What: records one purchase per paid invoice line
 * Why: lines are keyed on (invoice, price) so a redelivered invoice updates instead of duplicating
 */
package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.InvoicePayload;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.model.CustomerRecord;
import io.paysync.billing.model.PurchaseType;
import io.paysync.billing.repository.CustomerRepository;
import io.paysync.billing.repository.PurchaseRepository;
import io.paysync.billing.repository.PurchaseRepository.InvoiceLinePurchase;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(60)
@RequiredArgsConstructor
public class InvoicePaidHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(InvoicePaidHandler.class);

  private final ProviderPayloadReader payloadReader;
  private final CustomerRepository customerRepository;
  private final PurchaseRepository purchaseRepository;
  private final Clock clock;

  @Override
  public String eventType() {
    return BillingEventTypes.INVOICE_PAID;
  }

  @Override
  public void handle(JsonNode payload) {
    final InvoicePayload invoice = payloadReader.read(payload, InvoicePayload.class);
    if (invoice.id() == null) {
      throw new EventSkipException("invoice payload without id");
    }
    final CustomerRecord customer =
        customerRepository
            .findByExternalId(invoice.customer())
            .orElseThrow(
                () ->
                    new EventSkipException(
                        "invoice for unknown customer",
                        Map.of(
                            "external_invoice_id", invoice.id(),
                            "external_customer_id", String.valueOf(invoice.customer()))));
    final PurchaseType purchaseType = PurchaseType.fromBillingReason(invoice.billingReason());
    final Instant now = Instant.now(clock);
    int recorded = 0;
    for (InvoicePayload.Line line : invoice.lineItems()) {
      purchaseRepository.upsertInvoiceLine(
          new InvoiceLinePurchase(
              customer.id(),
              purchaseType,
              line.amountValue(),
              line.description(),
              invoice.id(),
              line.priceId(),
              invoice.charge(),
              invoice.paymentIntent()),
          now);
      recorded++;
    }
    logger.info(
        "invoice purchases recorded invoiceId={} customerId={} type={} lines={}",
        invoice.id(),
        customer.id(),
        purchaseType.dbValue(),
        recorded);
  }
}
