package io.paysync.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "billing.scheduled.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ScheduledEventWorker {

  private final ScheduledEventPoller poller;

  @Scheduled(fixedDelayString = "${billing.scheduled.poll-interval}")
  public void run() {
    poller.pollOnce();
  }
}
