package io.paysync.billing.model;

public record CustomerRecord(long id, String externalCustomerId, String billingEmail) {}
