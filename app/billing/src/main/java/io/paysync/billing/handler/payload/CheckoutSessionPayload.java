package io.paysync.billing.handler.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckoutSessionPayload(
    String id,
    String customer,
    String mode,
    String paymentStatus,
    Long amountTotal,
    String paymentIntent,
    Map<String, String> metadata) {

  public BigDecimal amountTotalValue() {
    final BigDecimal amount = ProviderUnits.centsToAmount(amountTotal);
    return amount == null ? BigDecimal.ZERO.setScale(2) : amount;
  }

  public String productName() {
    final String name = metadata == null ? null : metadata.get("product_name");
    return name == null || name.isBlank() ? "One-time purchase" : name;
  }
}
