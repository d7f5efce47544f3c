/*
 * Where: shared JDBC helpers
 * What: binds Instant values as explicit java.sql.Timestamp parameters
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant
 */
package io.paysync.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is always UTC; the database session time zone is irrelevant to the stored value.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
