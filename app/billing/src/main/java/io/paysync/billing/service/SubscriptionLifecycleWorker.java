package io.paysync.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.lifecycle.enabled", havingValue = "true")
public class SubscriptionLifecycleWorker {

  private final SubscriptionLifecycleService lifecycleService;

  @Scheduled(fixedDelayString = "${billing.lifecycle.sweep-interval}")
  public void run() {
    lifecycleService.sweep();
  }
}
