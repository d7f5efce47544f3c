package io.paysync.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String orNew(String traceId) {
    return traceId == null || traceId.isBlank() ? newTraceId() : traceId;
  }
}
