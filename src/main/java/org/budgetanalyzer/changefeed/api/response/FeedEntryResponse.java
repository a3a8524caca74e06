package org.budgetanalyzer.changefeed.api.response;

import java.time.Instant;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.service.dto.FeedPageEntry;

@Schema(description = "Event of a feed page")
public record FeedEntryResponse(
    @Schema(
            description =
                "Position of the entry as 32 hex characters. For provisional entries this is a"
                    + " presentation value that must not be used as a cursor",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0193a1b2c3d4e5f60718293a4b5c6d7e")
        String position,
    @Schema(
            description = "Aggregate the event belongs to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "7f1b4c1e-2f3a-4a5b-9c6d-0e1f2a3b4c5d")
        UUID aggregateId,
    @Schema(
            description = "Sequence of the event within its aggregate",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "3")
        long sequence,
    @Schema(
            description =
                "When the entry was appended to the feed; the staging time hint for provisional"
                    + " entries",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-10-31T15:30:00Z")
        Instant timestamp,
    @Schema(
            description =
                "True if the event is staged but not promoted yet; it will be returned again once"
                    + " promoted",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "false")
        boolean provisional) {

  public static FeedEntryResponse from(FeedPageEntry entry) {
    return new FeedEntryResponse(
        entry.position().toHex(),
        entry.aggregateId(),
        entry.sequence(),
        entry.timestamp(),
        entry.provisional());
  }
}
