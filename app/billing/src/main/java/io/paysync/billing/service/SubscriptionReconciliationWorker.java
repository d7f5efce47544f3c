package io.paysync.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.lifecycle.reconcile-enabled", havingValue = "true")
public class SubscriptionReconciliationWorker {

  private final SubscriptionReconciliationService reconciliationService;

  @Scheduled(fixedDelayString = "${billing.lifecycle.reconcile-interval}")
  public void run() {
    reconciliationService.reconcileStale();
  }
}
