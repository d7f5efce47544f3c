package io.paysync.billing.model;

/** Outcome of storing one inbound provider event; {@code created} is false for a redelivery. */
public record IngestResult(long eventId, boolean created) {}
