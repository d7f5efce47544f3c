/*
 * Where: billing event dispatch wiring
 * What: builds the HandlerRegistry from every BillingEventHandler bean
 * Why: bean list order follows @Order, which becomes the per-type dispatch order
 */
package io.paysync.billing.dispatch;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HandlerRegistryConfig {

  private static final Logger logger = LoggerFactory.getLogger(HandlerRegistryConfig.class);

  @Bean
  HandlerRegistry handlerRegistry(List<BillingEventHandler> handlers) {
    final HandlerRegistry.Builder builder = HandlerRegistry.builder();
    for (BillingEventHandler handler : handlers) {
      builder.register(handler);
    }
    final HandlerRegistry registry = builder.build();
    logger.info(
        "handler registry built handlers={} eventTypes={}",
        registry.size(),
        registry.eventTypes().size());
    return registry;
  }
}
