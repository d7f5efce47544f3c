package io.paysync.billing.api.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** A provider event that already passed signature verification at the boundary. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is read once by the controller and never mutated")
public record ProviderEventIngestRequest(
    @NotBlank String externalId, @NotBlank String type, @NotNull JsonNode payload) {}
