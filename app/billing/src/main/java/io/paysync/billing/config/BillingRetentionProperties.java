package io.paysync.billing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.retention")
public record BillingRetentionProperties(
    boolean enabled, Duration cleanupInterval, int retentionDays) {}
