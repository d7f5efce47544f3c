/*
 * Where: billing domain model
 * What: subscription statuses as reported by the payment provider, with the expected transitions
 * Why: status changes are applied even when unexpected, so the table only drives anomaly logging
 */
package io.paysync.billing.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public enum SubscriptionStatus {
  INCOMPLETE("incomplete"),
  INCOMPLETE_EXPIRED("incomplete_expired"),
  TRIALING("trialing"),
  ACTIVE("active"),
  PAST_DUE("past_due"),
  PAUSED("paused"),
  UNPAID("unpaid"),
  CANCELED("canceled");

  private static final Map<SubscriptionStatus, Set<SubscriptionStatus>> EXPECTED_TRANSITIONS =
      Map.of(
          INCOMPLETE, EnumSet.of(ACTIVE, INCOMPLETE_EXPIRED, CANCELED),
          INCOMPLETE_EXPIRED, EnumSet.noneOf(SubscriptionStatus.class),
          TRIALING, EnumSet.of(ACTIVE, PAST_DUE, CANCELED, PAUSED, UNPAID),
          ACTIVE, EnumSet.of(PAST_DUE, CANCELED, PAUSED, UNPAID),
          PAST_DUE, EnumSet.of(ACTIVE, CANCELED, UNPAID, PAUSED),
          PAUSED, EnumSet.of(ACTIVE, CANCELED),
          UNPAID, EnumSet.of(ACTIVE, CANCELED, PAST_DUE),
          CANCELED, EnumSet.noneOf(SubscriptionStatus.class));

  private final String wireValue;

  SubscriptionStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /** past_due keeps access during the provider's dunning grace period. */
  public boolean isActive() {
    return this == ACTIVE || this == TRIALING || this == PAST_DUE;
  }

  public boolean isTerminal() {
    return EXPECTED_TRANSITIONS.get(this).isEmpty();
  }

  public boolean canTransitionTo(SubscriptionStatus target) {
    return EXPECTED_TRANSITIONS.get(this).contains(target);
  }

  public Set<SubscriptionStatus> expectedTransitions() {
    final Set<SubscriptionStatus> targets = EXPECTED_TRANSITIONS.get(this);
    return targets.isEmpty() ? Set.of() : Set.copyOf(targets);
  }

  public static Optional<SubscriptionStatus> fromWireValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(status -> status.wireValue.equals(value)).findFirst();
  }
}
