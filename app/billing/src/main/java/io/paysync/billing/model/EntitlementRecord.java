/*
 * Where: billing domain model
 * What: snapshot of one entitlements row
 * Why: revoked rows stay in place for audit, so readers check isActive/expiry/usage themselves
 */
package io.paysync.billing.model;

import java.time.Instant;

public record EntitlementRecord(
    long id,
    long customerId,
    String feature,
    EntitlementSource grantedBy,
    Long subscriptionId,
    boolean active,
    Instant grantedAt,
    Instant expiresAt,
    Instant revokedAt,
    String revokeReason,
    Integer usageLimit,
    int usageCount) {

  public boolean isUsable(Instant now) {
    if (!active) {
      return false;
    }
    if (expiresAt != null && !now.isBefore(expiresAt)) {
      return false;
    }
    return usageLimit == null || usageCount < usageLimit;
  }
}
