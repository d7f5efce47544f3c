/*
 * Where: billing service layer
 * What: applies the retention horizon to processed provider events
 * Why: keeps the event store bounded without ever dropping an event that still needs work
 */
package io.paysync.billing.service;

import io.paysync.billing.config.BillingRetentionProperties;
import io.paysync.billing.repository.ProviderEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BillingRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(BillingRetentionService.class);

  private final ProviderEventRepository eventRepository;
  private final BillingRetentionProperties properties;
  private final Clock clock;

  /** @return number of deleted events */
  public int cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int exhausted = eventRepository.countExhausted();
    if (exhausted > 0) {
      logger.error("billing retention found exhausted provider events count={}", exhausted);
    }
    final int deleted = eventRepository.deleteProcessedOlderThan(threshold);
    logger.info(
        "billing retention cleanup deleted providerEvents={} threshold={}", deleted, threshold);
    return deleted;
  }
}
