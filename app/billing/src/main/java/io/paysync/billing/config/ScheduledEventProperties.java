/*
 * Where: billing configuration binding
 * What: poll cadence, claim size and attempt cap for scheduled events
 * Why: operators tune the poller separately from inbound provider events
 */
package io.paysync.billing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.scheduled")
public record ScheduledEventProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int maxAttempts,
    Duration lease,
    int errorMessageMaxLength) {}
