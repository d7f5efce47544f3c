/*
 * Where: billing retention tests
 * What: verifies cleanup removes only processed provider events older than the horizon
 * Why: unprocessed and exhausted events must survive any retention run
 */
package io.paysync.billing.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.paysync.billing.AbstractPostgresContainerTest;
import io.paysync.billing.BillingTables;
import io.paysync.billing.config.BillingRetentionProperties;
import io.paysync.billing.repository.ProviderEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class BillingRetentionServiceTest extends AbstractPostgresContainerTest {

    // Threshold comparisons are fixed to avoid boundary flakiness.
    private static final Instant FIXED_NOW = Instant.parse("2024-01-01T00:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean(name = "testClock")
        @Primary
        Clock clock() {
            return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private BillingRetentionService retentionService;

    @Autowired
    private BillingRetentionProperties retentionProperties;

    @Autowired
    private ProviderEventRepository eventRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        BillingTables.clear(jdbcTemplate);
    }

    @Test
    void cleanupRemovesOnlyOldProcessedEvents() {
        int retentionDays = retentionProperties.retentionDays();
        Instant old = FIXED_NOW.minus(Duration.ofDays(retentionDays + 1));
        Instant recent = FIXED_NOW.minus(Duration.ofDays(retentionDays - 1));

        processed("evt_old", old);
        processed("evt_recent", recent);
        exhausted("evt_exhausted", old);
        eventRepository.insertIfAbsent("evt_pending", "invoice.paid", "{}", null, old);

        int deleted = retentionService.cleanup();

        assertThat(deleted).isOne();
        assertThat(eventRepository.findIdByExternalId("evt_old")).isEmpty();
        assertThat(eventRepository.findIdByExternalId("evt_recent")).isPresent();
        assertThat(eventRepository.findIdByExternalId("evt_exhausted")).isPresent();
        assertThat(eventRepository.findIdByExternalId("evt_pending")).isPresent();
    }

    @Test
    void cleanupKeepsEventsJustInsideTheHorizon() {
        Instant inside = FIXED_NOW.minus(Duration.ofDays(retentionProperties.retentionDays())).plusSeconds(1);
        processed("evt_inside", inside);

        assertThat(retentionService.cleanup()).isZero();
        assertThat(BillingTables.count(jdbcTemplate, "SELECT COUNT(*) FROM provider_events")).isOne();
    }

    private void processed(String externalId, Instant at) {
        long id = eventRepository.insertIfAbsent(externalId, "invoice.paid", "{}", null, at).orElseThrow();
        eventRepository.claimById(id, at, at.plusSeconds(60), "test-worker");
        eventRepository.markProcessed(id, "test-worker", 1, at);
    }

    private void exhausted(String externalId, Instant at) {
        long id = eventRepository.insertIfAbsent(externalId, "invoice.paid", "{}", null, at).orElseThrow();
        eventRepository.claimById(id, at, at.plusSeconds(60), "test-worker");
        eventRepository.markExhausted(id, "test-worker", 5, at, "still failing");
    }
}
