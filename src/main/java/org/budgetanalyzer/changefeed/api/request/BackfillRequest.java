package org.budgetanalyzer.changefeed.api.request;

import java.time.Instant;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.service.dto.BackfillItem;

@Schema(description = "Historical event to insert into a shard's feed")
public record BackfillRequest(
    @Schema(
            description = "Aggregate the event belongs to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "7f1b4c1e-2f3a-4a5b-9c6d-0e1f2a3b4c5d")
        @NotNull
        UUID aggregateId,
    @Schema(
            description = "Sequence of the event within its aggregate",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "3")
        @NotNull
        Long sequence,
    @Schema(
            description = "When the event originally happened; positions the event in the feed",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-03-01T12:00:00Z")
        @NotNull
        @PastOrPresent
        Instant originalInstant) {

  public BackfillItem toItem() {
    return new BackfillItem(aggregateId, sequence, originalInstant);
  }
}
