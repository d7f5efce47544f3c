/*
 * Where: billing configuration binding
 * What: price id to feature keys mapping consulted on every subscription sync
 * Why: catalog changes must not require a deploy
 */
package io.paysync.billing.config;

import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.pricing")
public record PricingProperties(Map<String, List<String>> priceFeatures) {

  public PricingProperties {
    priceFeatures = priceFeatures == null ? Map.of() : Map.copyOf(priceFeatures);
  }

  /** Unknown prices map to no features, which revokes everything the subscription held. */
  public List<String> featuresFor(String priceId) {
    if (priceId == null) {
      return List.of();
    }
    return List.copyOf(priceFeatures.getOrDefault(priceId, List.of()));
  }
}
