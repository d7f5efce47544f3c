/*
 * Where: subscription handler integration tests
 * What: drives provider subscription events through ingestion and the processor
 * Why: status, period and entitlements must stay in step across out-of-order deliveries
 */
package io.paysync.billing.handler;

import static org.assertj.core.api.Assertions.assertThat;

import io.paysync.billing.AbstractPostgresContainerTest;
import io.paysync.billing.BillingTables;
import io.paysync.billing.model.CustomerRecord;
import io.paysync.billing.model.EntitlementRecord;
import io.paysync.billing.model.IngestResult;
import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.model.SubscriptionStatus;
import io.paysync.billing.repository.CustomerRepository;
import io.paysync.billing.repository.EntitlementRepository;
import io.paysync.billing.repository.SubscriptionRepository;
import io.paysync.billing.service.EntitlementReconciler;
import io.paysync.billing.service.EventIngestionService;
import io.paysync.billing.service.ProviderEventProcessor;
import io.paysync.billing.service.SubscriptionSyncService;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SubscriptionEventFlowTest extends AbstractPostgresContainerTest {

  private static final String PRO_PRICE = "price_pro_monthly";
  private static final String BASIC_PRICE = "price_basic_monthly";

  @Autowired private EventIngestionService ingestionService;
  @Autowired private ProviderEventProcessor processor;
  @Autowired private CustomerRepository customerRepository;
  @Autowired private SubscriptionRepository subscriptionRepository;
  @Autowired private EntitlementRepository entitlementRepository;
  @Autowired private EntitlementReconciler reconciler;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private final AtomicInteger eventSequence = new AtomicInteger();

  @BeforeEach
  void setUp() {
    BillingTables.clear(jdbcTemplate);
  }

  @Test
  void createdBeforeCustomerSyncIsRetriedThenAppliedOnRedelivery() {
    final String created = subscription("sub_1", "cus_1", "active", PRO_PRICE, true, false);
    final IngestResult first =
        ingestionService.ingest("evt_created", BillingEventTypes.SUBSCRIPTION_CREATED, created, null);

    processor.process(first.eventId());

    assertThat(eventRow(first.eventId()).get("fully_processed")).isEqualTo(false);
    assertThat(eventRow(first.eventId()).get("attempt_count")).isEqualTo(1);
    assertThat(subscriptionRepository.findByExternalId("sub_1")).isEmpty();

    final CustomerRecord customer = customerRepository.insert("cus_1", null, Instant.now());
    final IngestResult redelivered =
        ingestionService.ingest("evt_created", BillingEventTypes.SUBSCRIPTION_CREATED, created, null);
    assertThat(redelivered.created()).isFalse();
    assertThat(redelivered.eventId()).isEqualTo(first.eventId());

    assertThat(processor.processDueBatch()).isOne();

    final SubscriptionRecord stored = subscriptionRepository.findByExternalId("sub_1").orElseThrow();
    assertThat(stored.status()).isEqualTo(SubscriptionStatus.ACTIVE);
    assertThat(stored.customerId()).isEqualTo(customer.id());
    assertThat(stored.currentPeriodEnd()).isNotNull();
    assertThat(reconciler.activeFeatures(customer.id()))
        .containsExactly("api_access", "priority_support", "pro");
    assertThat(eventRow(first.eventId()).get("fully_processed")).isEqualTo(true);
  }

  @Test
  void pastDueKeepsAccessAndUnpaidRevokesIt() {
    final CustomerRecord customer = customerWithActiveSubscription("sub_1", PRO_PRICE);

    deliver(BillingEventTypes.SUBSCRIPTION_UPDATED,
        subscription("sub_1", "cus_1", "past_due", PRO_PRICE, true, false));
    assertThat(reconciler.hasAccess(customer.id(), "pro")).isTrue();

    deliver(BillingEventTypes.SUBSCRIPTION_UPDATED,
        subscription("sub_1", "cus_1", "unpaid", PRO_PRICE, true, false));

    assertThat(subscriptionRepository.findByExternalId("sub_1").orElseThrow().status())
        .isEqualTo(SubscriptionStatus.UNPAID);
    assertThat(reconciler.activeFeatures(customer.id())).isEmpty();
    assertThat(entitlementRepository.findByCustomer(customer.id()))
        .extracting(EntitlementRecord::revokeReason)
        .containsOnly(SubscriptionSyncService.REASON_STATUS_CHANGED + "unpaid");
  }

  @Test
  void priceChangeSyncsFeatureDifference() {
    final CustomerRecord customer = customerWithActiveSubscription("sub_1", PRO_PRICE);

    deliver(BillingEventTypes.SUBSCRIPTION_UPDATED,
        subscription("sub_1", "cus_1", "active", BASIC_PRICE, true, true));

    final SubscriptionRecord stored = subscriptionRepository.findByExternalId("sub_1").orElseThrow();
    assertThat(stored.priceId()).isEqualTo(BASIC_PRICE);
    assertThat(stored.cancelAtPeriodEnd()).isTrue();
    assertThat(reconciler.activeFeatures(customer.id())).containsExactly("basic");
  }

  @Test
  void updateBeforeCreateIsRetried() {
    customerRepository.insert("cus_1", null, Instant.now());

    final long eventId = deliver(BillingEventTypes.SUBSCRIPTION_UPDATED,
        subscription("sub_missing", "cus_1", "active", PRO_PRICE, true, false));

    final Map<String, Object> row = eventRow(eventId);
    assertThat(row.get("fully_processed")).isEqualTo(false);
    assertThat((String) row.get("last_error")).contains("subscription not synced yet");
  }

  @Test
  void deletedCancelsAndRevokes() {
    final CustomerRecord customer = customerWithActiveSubscription("sub_1", PRO_PRICE);

    deliver(BillingEventTypes.SUBSCRIPTION_DELETED,
        subscription("sub_1", "cus_1", "canceled", PRO_PRICE, true, false));

    final SubscriptionRecord stored = subscriptionRepository.findByExternalId("sub_1").orElseThrow();
    assertThat(stored.status()).isEqualTo(SubscriptionStatus.CANCELED);
    assertThat(stored.canceledAt()).isNotNull();
    assertThat(reconciler.activeFeatures(customer.id())).isEmpty();
    assertThat(entitlementRepository.findByCustomer(customer.id()))
        .extracting(EntitlementRecord::revokeReason)
        .containsOnly(SubscriptionSyncService.REASON_CANCELED);
  }

  @Test
  void deletedForUnknownSubscriptionIsSkipped() {
    final long eventId = deliver(BillingEventTypes.SUBSCRIPTION_DELETED,
        subscription("sub_unknown", "cus_1", "canceled", PRO_PRICE, true, false));

    assertThat(eventRow(eventId).get("fully_processed")).isEqualTo(true);
    assertThat(eventRow(eventId).get("last_error")).isNull();
  }

  @Test
  void pauseRevokesAndResumeRestoresWithNewPeriod() {
    final CustomerRecord customer = customerWithActiveSubscription("sub_1", PRO_PRICE);

    deliver(BillingEventTypes.SUBSCRIPTION_PAUSED,
        subscription("sub_1", "cus_1", "paused", PRO_PRICE, true, false));

    final SubscriptionRecord paused = subscriptionRepository.findByExternalId("sub_1").orElseThrow();
    assertThat(paused.status()).isEqualTo(SubscriptionStatus.PAUSED);
    assertThat(paused.pausedAt()).isNotNull();
    assertThat(reconciler.activeFeatures(customer.id())).isEmpty();

    final long newEnd = Instant.now().plus(Duration.ofDays(45)).getEpochSecond();
    deliver(BillingEventTypes.SUBSCRIPTION_RESUMED,
        subscription("sub_1", "cus_1", "active", PRO_PRICE, true, false)
            .replaceFirst("\"current_period_end\": \\d+", "\"current_period_end\": " + newEnd));

    final SubscriptionRecord resumed = subscriptionRepository.findByExternalId("sub_1").orElseThrow();
    assertThat(resumed.status()).isEqualTo(SubscriptionStatus.ACTIVE);
    assertThat(resumed.pausedAt()).isNull();
    assertThat(resumed.resumedAt()).isNotNull();
    assertThat(resumed.currentPeriodEnd()).isEqualTo(Instant.ofEpochSecond(newEnd));
    assertThat(reconciler.activeFeatures(customer.id()))
        .containsExactly("api_access", "priority_support", "pro");
  }

  @Test
  void unknownStatusIsSkipped() {
    customerRepository.insert("cus_1", null, Instant.now());

    final long eventId = deliver(BillingEventTypes.SUBSCRIPTION_CREATED,
        subscription("sub_1", "cus_1", "frozen", PRO_PRICE, true, false));

    assertThat(eventRow(eventId).get("fully_processed")).isEqualTo(true);
    assertThat(subscriptionRepository.findByExternalId("sub_1")).isEmpty();
  }

  @Test
  void missingPeriodWithoutProviderSnapshotIsSkipped() {
    customerRepository.insert("cus_1", null, Instant.now());

    final long eventId = deliver(BillingEventTypes.SUBSCRIPTION_CREATED,
        subscription("sub_1", "cus_1", "active", PRO_PRICE, false, false));

    assertThat(eventRow(eventId).get("fully_processed")).isEqualTo(true);
    assertThat(subscriptionRepository.findByExternalId("sub_1")).isEmpty();
  }

  @Test
  void redeliveredCreateRefreshesWithoutDuplicateEntitlements() {
    final CustomerRecord customer = customerWithActiveSubscription("sub_1", PRO_PRICE);

    deliver(BillingEventTypes.SUBSCRIPTION_CREATED,
        subscription("sub_1", "cus_1", "active", PRO_PRICE, true, false));

    assertThat(entitlementRepository.findByCustomer(customer.id())).hasSize(3);
  }

  private CustomerRecord customerWithActiveSubscription(String subscriptionId, String priceId) {
    final CustomerRecord customer = customerRepository.insert("cus_1", null, Instant.now());
    deliver(BillingEventTypes.SUBSCRIPTION_CREATED,
        subscription(subscriptionId, "cus_1", "active", priceId, true, false));
    return customer;
  }

  private long deliver(String eventType, String payloadJson) {
    final String externalId = "evt_" + eventSequence.incrementAndGet();
    final long eventId = ingestionService.ingest(externalId, eventType, payloadJson, null).eventId();
    processor.process(eventId);
    return eventId;
  }

  private Map<String, Object> eventRow(long eventId) {
    return jdbcTemplate.queryForMap(
        "SELECT * FROM provider_events WHERE id = :id", new MapSqlParameterSource("id", eventId));
  }

  static String subscription(
      String id,
      String customer,
      String status,
      String priceId,
      boolean withPeriod,
      boolean cancelAtPeriodEnd) {
    final Instant now = Instant.now();
    final String period =
        withPeriod
            ? """
              "current_period_start": %d,
              "current_period_end": %d,
              """
                .formatted(
                    now.minus(Duration.ofDays(1)).getEpochSecond(),
                    now.plus(Duration.ofDays(29)).getEpochSecond())
            : "";
    return """
        {
          "id": "%s",
          "object": "subscription",
          "customer": "%s",
          "status": "%s",
          %s"cancel_at_period_end": %s,
          "items": {"data": [{"price": {"id": "%s"}}]}
        }
        """
        .formatted(id, customer, status, period, cancelAtPeriodEnd, priceId);
  }
}
