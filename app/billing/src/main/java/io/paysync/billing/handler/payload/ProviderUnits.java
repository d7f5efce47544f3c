package io.paysync.billing.handler.payload;

import java.math.BigDecimal;
import java.time.Instant;

// provider payloads carry epoch seconds and integer minor units
final class ProviderUnits {
  private ProviderUnits() {}

  static Instant toInstant(Long epochSeconds) {
    return epochSeconds == null ? null : Instant.ofEpochSecond(epochSeconds);
  }

  static BigDecimal centsToAmount(Long cents) {
    return cents == null ? null : BigDecimal.valueOf(cents, 2);
  }
}
