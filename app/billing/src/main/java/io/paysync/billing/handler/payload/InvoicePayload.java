package io.paysync.billing.handler.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvoicePayload(
    String id,
    String customer,
    String billingReason,
    String charge,
    String paymentIntent,
    Lines lines) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Lines(List<Line> data) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Line(long amount, String description, Price price) {

    public BigDecimal amountValue() {
      return ProviderUnits.centsToAmount(amount);
    }

    public String priceId() {
      return price == null || price.id() == null ? "" : price.id();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Price(String id) {}

  public List<Line> lineItems() {
    return lines == null || lines.data() == null ? List.of() : lines.data();
  }
}
