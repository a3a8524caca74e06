package org.budgetanalyzer.changefeed.api.request;

import java.time.Instant;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.service.dto.StageItem;

@Schema(description = "Event key to stage in a shard's outbox")
public record StageRequest(
    @Schema(
            description = "Aggregate the event belongs to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "7f1b4c1e-2f3a-4a5b-9c6d-0e1f2a3b4c5d")
        @NotNull
        UUID aggregateId,
    @Schema(
            description = "Sequence of the event within its aggregate",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "4")
        @NotNull
        Long sequence,
    @Schema(
            description = "Time of the write; defaults to now",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "2025-10-31T15:30:00Z")
        Instant timeHint) {

  public StageItem toItem() {
    return new StageItem(aggregateId, sequence, timeHint);
  }
}
