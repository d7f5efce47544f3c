/*
 * Where: billing API
 * What: standard error body
 * Why: the webhook boundary branches on the code, never on the message
 */
package io.paysync.billing.api;

public record ApiErrorResponse(String code, String message) {}
