package io.paysync.billing.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.paysync.billing.repository.HandlerCompletionRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

class EventDispatcherTest {

  private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");
  private static final JsonNode PAYLOAD = JsonNodeFactory.instance.objectNode().put("id", "in_1");

  private HandlerCompletionRepository completionRepository;
  private RecordingTransactionManager transactionManager;
  private List<String> calls;

  @BeforeEach
  void setUp() {
    completionRepository = mock(HandlerCompletionRepository.class);
    when(completionRepository.markCompleted(anyLong(), anyString(), any())).thenReturn(1);
    transactionManager = new RecordingTransactionManager();
    calls = new ArrayList<>();
  }

  @Test
  void dispatchRunsHandlersInOrderAndCountsThem() {
    final EventDispatcher dispatcher =
        dispatcher(new Recording("first", true, false), new Recording("second", false, false));

    final int invoked = dispatcher.dispatch("invoice.paid", PAYLOAD);

    assertThat(invoked).isEqualTo(2);
    assertThat(calls).containsExactly("first", "second");
    assertThat(transactionManager.commits).isEqualTo(1);
  }

  @Test
  void dispatchWithoutHandlersInvokesNothing() {
    final EventDispatcher dispatcher = dispatcher(new Recording("first", true, false));

    assertThat(dispatcher.dispatch("customer.deleted", PAYLOAD)).isZero();
    assertThat(calls).isEmpty();
  }

  @Test
  void dispatchTrackedSkipsCompletedHandlers() {
    when(completionRepository.lockCompleted(7L, "first")).thenReturn(true);
    when(completionRepository.lockCompleted(7L, "second")).thenReturn(false);
    final EventDispatcher dispatcher =
        dispatcher(new Recording("first", true, false), new Recording("second", true, false));

    final int invoked = dispatcher.dispatchTracked(7L, "invoice.paid", PAYLOAD);

    assertThat(invoked).isEqualTo(1);
    assertThat(calls).containsExactly("second");
    verify(completionRepository).ensureExists(7L, "first", NOW);
    verify(completionRepository).ensureExists(7L, "second", NOW);
    verify(completionRepository, never()).markCompleted(eq(7L), eq("first"), any());
    verify(completionRepository).markCompleted(7L, "second", NOW);
  }

  @Test
  void dispatchTrackedStopsAtFirstFailure() {
    final EventDispatcher dispatcher =
        dispatcher(
            new Recording("first", true, false),
            new Recording("broken", true, true),
            new Recording("third", true, false));

    assertThatThrownBy(() -> dispatcher.dispatchTracked(9L, "invoice.paid", PAYLOAD))
        .isInstanceOf(EventRetryException.class);

    assertThat(calls).containsExactly("first", "broken");
    verify(completionRepository).markCompleted(9L, "first", NOW);
    verify(completionRepository, never()).markCompleted(eq(9L), eq("broken"), any());
    verify(completionRepository, never()).ensureExists(eq(9L), eq("third"), any());
    assertThat(transactionManager.rollbacks).isEqualTo(1);
  }

  @Test
  void handlerSeesCompletionCommittedWhileItWaitedForTheLock() {
    when(completionRepository.lockCompleted(5L, "refund")).thenReturn(false, true);
    final EventDispatcher dispatcher = dispatcher(new Recording("refund", true, false));

    final int firstPass = dispatcher.dispatchTracked(5L, "invoice.paid", PAYLOAD);
    final int secondPass = dispatcher.dispatchTracked(5L, "invoice.paid", PAYLOAD);

    assertThat(firstPass).isOne();
    assertThat(secondPass).isZero();
    assertThat(calls).containsExactly("refund");
    verify(completionRepository, never()).isCompleted(anyLong(), anyString());
  }

  @Test
  void lostCompletionMarkRollsBackHandlerEffects() {
    when(completionRepository.markCompleted(anyLong(), anyString(), any())).thenReturn(1, 0);
    final EventDispatcher dispatcher = dispatcher(new Recording("refund", true, false));

    assertThat(dispatcher.dispatchTracked(5L, "invoice.paid", PAYLOAD)).isOne();
    assertThatThrownBy(() -> dispatcher.dispatchTracked(5L, "invoice.paid", PAYLOAD))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("handler=refund");

    assertThat(transactionManager.commits).isOne();
    assertThat(transactionManager.rollbacks).isOne();
  }

  @Test
  void nonTransactionalHandlerIsMarkedOutsideTransaction() {
    final EventDispatcher dispatcher = dispatcher(new Recording("logger", false, false));

    dispatcher.dispatchTracked(3L, "invoice.paid", PAYLOAD);

    assertThat(transactionManager.commits).isZero();
    verify(completionRepository).markCompleted(3L, "logger", NOW);
  }

  private EventDispatcher dispatcher(BillingEventHandler... handlers) {
    final HandlerRegistry.Builder builder = HandlerRegistry.builder();
    for (BillingEventHandler handler : handlers) {
      builder.register(handler);
    }
    return new EventDispatcher(
        builder.build(),
        completionRepository,
        transactionManager,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private final class Recording implements BillingEventHandler {

    private final String name;
    private final boolean transactional;
    private final boolean fails;

    private Recording(String name, boolean transactional, boolean fails) {
      this.name = name;
      this.transactional = transactional;
      this.fails = fails;
    }

    @Override
    public String eventType() {
      return "invoice.paid";
    }

    @Override
    public void handle(JsonNode payload) {
      calls.add(name);
      if (fails) {
        throw new EventRetryException("customer not synced yet");
      }
    }

    @Override
    public boolean runsInTransaction() {
      return transactional;
    }

    @Override
    public String name() {
      return name;
    }
  }

  private static final class RecordingTransactionManager
      extends AbstractPlatformTransactionManager {

    private static final long serialVersionUID = 1L;

    private int commits;
    private int rollbacks;

    @Override
    protected Object doGetTransaction() {
      return new Object();
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {}

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
      commits++;
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
      rollbacks++;
    }
  }
}
