package io.paysync.billing.model;

import java.util.Locale;

public enum PurchaseStatus {
  PAID,
  REFUNDED,
  PARTIALLY_REFUNDED,
  DISPUTED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PurchaseStatus fromDbValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
