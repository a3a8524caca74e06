package org.budgetanalyzer.changefeed.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.service.dto.BackfillResult;

@Schema(description = "Outcome of a backfill batch")
public record BackfillResultResponse(
    @Schema(description = "Shard written to", requiredMode = Schema.RequiredMode.REQUIRED)
        int shardId,
    @Schema(
            description = "Events inserted into the feed",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "100")
        int inserted,
    @Schema(
            description = "Events already in the feed",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "3")
        int skipped,
    @Schema(
            description = "Timestamp of the batch",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-10-31T15:30:00Z")
        Instant timestamp) {

  public static BackfillResultResponse from(BackfillResult backfillResult) {
    return new BackfillResultResponse(
        backfillResult.shardId(),
        backfillResult.inserted(),
        backfillResult.skipped(),
        backfillResult.timestamp());
  }
}
