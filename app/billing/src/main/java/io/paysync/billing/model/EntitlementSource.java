package io.paysync.billing.model;

import java.util.Arrays;
import java.util.Locale;

public enum EntitlementSource {
  SUBSCRIPTION,
  TRIAL,
  MANUAL,
  PROMO,
  REFERRAL,
  EMPLOYEE;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EntitlementSource fromDbValue(String value) {
    return Arrays.stream(values())
        .filter(source -> source.dbValue().equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown entitlement source: " + value));
  }
}
