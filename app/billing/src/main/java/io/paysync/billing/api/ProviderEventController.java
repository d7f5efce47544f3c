/*
 * Where: billing API
 * What: internal endpoint the webhook boundary posts verified provider events to
 * Why: the boundary needs an immediate acknowledgement; dispatch is left to the worker
 */
package io.paysync.billing.api;

import io.paysync.billing.api.request.ProviderEventIngestRequest;
import io.paysync.billing.api.response.ProviderEventIngestResponse;
import io.paysync.billing.config.RequestMdcInterceptor;
import io.paysync.billing.model.IngestResult;
import io.paysync.billing.service.EventIngestionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/provider-events")
@RequiredArgsConstructor
public class ProviderEventController {

  private final EventIngestionService ingestionService;

  /** Duplicates are acknowledged with 200 as well; {@code created} tells them apart. */
  @PostMapping
  public ResponseEntity<ProviderEventIngestResponse> ingest(
      @Valid @RequestBody ProviderEventIngestRequest request, HttpServletRequest httpRequest) {
    if (!request.payload().isObject()) {
      throw new IllegalArgumentException("payload must be a JSON object");
    }
    final Object traceId = httpRequest.getAttribute(RequestMdcInterceptor.TRACE_ID_ATTRIBUTE);
    final IngestResult result =
        ingestionService.ingest(
            request.externalId(),
            request.type(),
            request.payload().toString(),
            traceId instanceof String value ? value : null);
    return ResponseEntity.ok(new ProviderEventIngestResponse(result.eventId(), result.created()));
  }
}
