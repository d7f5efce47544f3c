package io.paysync.billing.service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lock owner written into lease columns; the pod hostname when available. */
final class WorkerIdentity {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private WorkerIdentity() {}

  static String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  static String truncateError(Throwable failure, int maxLength) {
    final String message = failure == null ? null : failure.getMessage();
    if (message == null) {
      return failure == null ? "unknown error" : failure.getClass().getName();
    }
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
