/*
 * Where: billing provider event worker
 * What: triggers provider event processing on a schedule
 * Why: the inbound endpoint only stores events; dispatch happens here, off the request path
 */
package io.paysync.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.events.enabled", havingValue = "true", matchIfMissing = true)
public class ProviderEventWorker {

  private final ProviderEventProcessor processor;

  @Scheduled(fixedDelayString = "${billing.events.poll-interval}")
  public void run() {
    processor.processDueBatch();
  }
}
