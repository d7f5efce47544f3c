/*
 * Where: billing domain model
 * What: a claimed provider_events row handed to the processor
 * Why: the processor needs the payload and the retry bookkeeping, not the full row
 */
package io.paysync.billing.model;

import java.time.Instant;

public record ProviderEventRecord(
    long id,
    String externalId,
    String eventType,
    String payloadJson,
    String traceId,
    Instant receivedAt,
    int attemptCount) {}
