package io.paysync.billing.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

class HandlerRegistryTest {

  @Test
  void handlersForPreservesRegistrationOrder() {
    final BillingEventHandler first = new NamedHandler("invoice.paid", "first");
    final BillingEventHandler second = new NamedHandler("invoice.paid", "second");
    final BillingEventHandler other = new NamedHandler("charge.refunded", "refund");

    final HandlerRegistry registry =
        HandlerRegistry.builder().register(first).register(other).register(second).build();

    assertThat(registry.handlersFor("invoice.paid")).containsExactly(first, second);
    assertThat(registry.handlersFor("charge.refunded")).containsExactly(other);
    assertThat(registry.eventTypes()).containsExactlyInAnyOrder("invoice.paid", "charge.refunded");
    assertThat(registry.size()).isEqualTo(3);
  }

  @Test
  void handlersForUnknownTypeIsEmpty() {
    final HandlerRegistry registry =
        HandlerRegistry.builder().register(new NamedHandler("invoice.paid", "first")).build();

    assertThat(registry.handlersFor("customer.deleted")).isEmpty();
  }

  @Test
  void registerRejectsDuplicateNameForSameType() {
    final HandlerRegistry.Builder builder =
        HandlerRegistry.builder().register(new NamedHandler("invoice.paid", "ledger"));

    assertThatThrownBy(() -> builder.register(new NamedHandler("invoice.paid", "ledger")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("name=ledger");
  }

  @Test
  void sameNameMayServeDifferentTypes() {
    final HandlerRegistry registry =
        HandlerRegistry.builder()
            .register(new NamedHandler("invoice.paid", "ledger"))
            .register(new NamedHandler("charge.refunded", "ledger"))
            .build();

    assertThat(registry.size()).isEqualTo(2);
  }

  @Test
  void registerRejectsBlankEventType() {
    assertThatThrownBy(
            () -> HandlerRegistry.builder().register(" ", new NamedHandler("invoice.paid", "x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void defaultNameIsSimpleClassName() {
    final BillingEventHandler handler = new InvoiceLedgerHandler();

    assertThat(handler.name()).isEqualTo("InvoiceLedgerHandler");
    assertThat(handler.runsInTransaction()).isTrue();
  }

  private static final class InvoiceLedgerHandler implements BillingEventHandler {

    @Override
    public String eventType() {
      return "invoice.paid";
    }

    @Override
    public void handle(JsonNode payload) {}
  }

  private record NamedHandler(String eventType, String name) implements BillingEventHandler {

    @Override
    public void handle(JsonNode payload) {}
  }
}
