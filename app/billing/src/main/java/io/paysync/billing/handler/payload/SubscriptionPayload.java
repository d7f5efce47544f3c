/*
 * Where: provider payload mapping
 * What: the subset of a provider subscription object the billing handlers read
 * Why: provider timestamps are epoch seconds; conversion happens once, here
 */
package io.paysync.billing.handler.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscriptionPayload(
    String id,
    String customer,
    String status,
    Items items,
    Long currentPeriodStart,
    Long currentPeriodEnd,
    boolean cancelAtPeriodEnd,
    Long canceledAt,
    Long trialStart,
    Long trialEnd) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Items(List<Item> data) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Item(Price price) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Price(String id) {}

  public boolean hasPeriod() {
    return currentPeriodStart != null && currentPeriodEnd != null;
  }

  /** First item's price; subscriptions in this catalog carry a single price. */
  public String priceId() {
    if (items == null || items.data() == null || items.data().isEmpty()) {
      return null;
    }
    final Item first = items.data().get(0);
    return first == null || first.price() == null ? null : first.price().id();
  }

  public Instant currentPeriodStartInstant() {
    return ProviderUnits.toInstant(currentPeriodStart);
  }

  public Instant currentPeriodEndInstant() {
    return ProviderUnits.toInstant(currentPeriodEnd);
  }

  public Instant canceledAtInstant() {
    return ProviderUnits.toInstant(canceledAt);
  }

  public Instant trialStartInstant() {
    return ProviderUnits.toInstant(trialStart);
  }

  public Instant trialEndInstant() {
    return ProviderUnits.toInstant(trialEnd);
  }
}
