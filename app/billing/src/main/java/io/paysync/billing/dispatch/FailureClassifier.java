/*
 * Where: billing event dispatch
 * What: maps any throwable escaping a handler onto a FailureKind
 * Why: the processor and the scheduled poller share one verdict for the same failure
 */
package io.paysync.billing.dispatch;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

public final class FailureClassifier {

  private static final int MAX_CAUSE_DEPTH = 8;

  private FailureClassifier() {}

  public static FailureKind classify(Throwable failure) {
    if (failure instanceof EventSkipException) {
      return FailureKind.SKIP;
    }
    if (failure instanceof EventInfrastructureException) {
      return FailureKind.INFRASTRUCTURE;
    }
    if (failure instanceof EventRetryException) {
      return FailureKind.RETRY;
    }
    Throwable current = failure;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (isInfrastructure(current)) {
        return FailureKind.INFRASTRUCTURE;
      }
      current = current.getCause();
    }
    return FailureKind.UNCLASSIFIED;
  }

  private static boolean isInfrastructure(Throwable failure) {
    // CannotGetJdbcConnectionException extends DataAccessResourceFailureException
    return failure instanceof TransientDataAccessException
        || failure instanceof DataAccessResourceFailureException
        || failure instanceof CannotCreateTransactionException
        || failure instanceof SocketTimeoutException
        || failure instanceof ConnectException
        || failure instanceof SocketException
        || failure instanceof InterruptedIOException;
  }
}
