package io.paysync.billing.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.SocketTimeoutException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

class FailureClassifierTest {

  @Test
  void skipIsTerminal() {
    final FailureKind kind =
        FailureClassifier.classify(
            new EventSkipException("customer not found", Map.of("customer_id", "cus_1")));

    assertThat(kind).isEqualTo(FailureKind.SKIP);
    assertThat(kind.retryable()).isFalse();
  }

  @Test
  void retryAndInfrastructureAreRetryable() {
    assertThat(FailureClassifier.classify(new EventRetryException("not synced yet")))
        .isEqualTo(FailureKind.RETRY);
    assertThat(
            FailureClassifier.classify(
                new EventInfrastructureException("provider api down", new SocketTimeoutException())))
        .isEqualTo(FailureKind.INFRASTRUCTURE);
    assertThat(FailureKind.RETRY.retryable()).isTrue();
    assertThat(FailureKind.INFRASTRUCTURE.retryable()).isTrue();
  }

  @Test
  void transientDatabaseFailuresAreInfrastructure() {
    assertThat(FailureClassifier.classify(new CannotAcquireLockException("lock timeout")))
        .isEqualTo(FailureKind.INFRASTRUCTURE);
    assertThat(
            FailureClassifier.classify(
                new CannotGetJdbcConnectionException("pool exhausted")))
        .isEqualTo(FailureKind.INFRASTRUCTURE);
  }

  @Test
  void wrappedSocketTimeoutIsInfrastructure() {
    final RuntimeException wrapped =
        new IllegalStateException("call failed", new SocketTimeoutException("read timed out"));

    assertThat(FailureClassifier.classify(wrapped)).isEqualTo(FailureKind.INFRASTRUCTURE);
  }

  @Test
  void unexpectedErrorsAreUnclassifiedButRetried() {
    final FailureKind npe = FailureClassifier.classify(new NullPointerException("price"));
    final FailureKind integrity =
        FailureClassifier.classify(new DataIntegrityViolationException("check failed"));

    assertThat(npe).isEqualTo(FailureKind.UNCLASSIFIED);
    assertThat(integrity).isEqualTo(FailureKind.UNCLASSIFIED);
    assertThat(npe.retryable()).isTrue();
  }

  @Test
  void skipContextIsCopied() {
    final EventSkipException skip =
        new EventSkipException("no purchase", Map.of("invoice_id", "in_1"));

    assertThat(skip.key()).isEqualTo(EventSkipException.KEY);
    assertThat(skip.expected()).isTrue();
    assertThat(skip.context()).containsEntry("invoice_id", "in_1");
  }
}
