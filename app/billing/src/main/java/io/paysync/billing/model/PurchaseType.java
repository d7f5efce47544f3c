package io.paysync.billing.model;

import java.util.Locale;

public enum PurchaseType {
  SUBSCRIPTION_NEW,
  SUBSCRIPTION_RENEWAL,
  SUBSCRIPTION_UPGRADE,
  ONE_TIME;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PurchaseType fromDbValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }

  /** Maps the provider's invoice billing reason; anything unrecognised is a one-time charge. */
  public static PurchaseType fromBillingReason(String billingReason) {
    if (billingReason == null) {
      return ONE_TIME;
    }
    return switch (billingReason) {
      case "subscription_create" -> SUBSCRIPTION_NEW;
      case "subscription_cycle" -> SUBSCRIPTION_RENEWAL;
      case "subscription_update" -> SUBSCRIPTION_UPGRADE;
      default -> ONE_TIME;
    };
  }
}
