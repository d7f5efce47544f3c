/*
 * Where: billing service layer
 * What: stores inbound provider events exactly once per external id
 * Why: the provider delivers at least once; the boundary acknowledges duplicates like new events
 */
package io.paysync.billing.service;

import io.paysync.billing.model.IngestResult;
import io.paysync.billing.repository.ProviderEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EventIngestionService {

  private static final Logger logger = LoggerFactory.getLogger(EventIngestionService.class);

  private final ProviderEventRepository eventRepository;
  private final Clock clock;

  /**
   * Stores the event, or resolves the already stored row when the external id was seen before.
   * Only the caller whose insert won observes {@code created=true}. Processing is left to the
   * worker.
   */
  public IngestResult ingest(
      String externalId, String eventType, String payloadJson, String traceId) {
    if (externalId == null || externalId.isBlank()) {
      throw new IllegalArgumentException("externalId must not be blank");
    }
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("eventType must not be blank");
    }
    if (payloadJson == null || payloadJson.isBlank()) {
      throw new IllegalArgumentException("payload must not be blank");
    }
    final Instant now = Instant.now(clock);
    final Optional<Long> inserted =
        eventRepository.insertIfAbsent(externalId, eventType, payloadJson, traceId, now);
    if (inserted.isPresent()) {
      logger.info(
          "provider event stored eventId={} externalId={} eventType={}",
          inserted.get(),
          externalId,
          eventType);
      return new IngestResult(inserted.get(), true);
    }
    final long existingId =
        eventRepository
            .findIdByExternalId(externalId)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "duplicate provider event not found externalId=" + externalId));
    final int rearmed = eventRepository.rearmUnprocessed(externalId, now);
    logger.info(
        "provider event duplicate eventId={} externalId={} eventType={} rearmed={}",
        existingId,
        externalId,
        eventType,
        rearmed > 0);
    return new IngestResult(existingId, false);
  }
}
