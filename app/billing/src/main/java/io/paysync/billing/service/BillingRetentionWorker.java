/*
 * Where: billing cleanup worker
 * What: triggers retention cleanup on a schedule
 * Why: automate deletion without manual intervention
 */
package io.paysync.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.retention.enabled", havingValue = "true")
public class BillingRetentionWorker {

  private final BillingRetentionService retentionService;

  @Scheduled(fixedDelayString = "${billing.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
