package io.paysync.billing.handler.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChargePayload(String id, String invoice, long amountRefunded) {

  public BigDecimal amountRefundedValue() {
    return ProviderUnits.centsToAmount(amountRefunded);
  }
}
