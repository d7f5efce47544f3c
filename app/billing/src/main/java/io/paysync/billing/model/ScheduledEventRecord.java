package io.paysync.billing.model;

import java.time.Instant;

public record ScheduledEventRecord(
    long id, String eventType, Instant executeAt, String payloadJson, int attempts) {}
