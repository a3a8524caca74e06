package org.budgetanalyzer.changefeed.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.service.dto.StageResult;

@Schema(description = "Outcome of staging event keys")
public record StageResultResponse(
    @Schema(description = "Shard staged into", requiredMode = Schema.RequiredMode.REQUIRED)
        int shardId,
    @Schema(
            description = "Keys that created a new outbox row",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "10")
        int staged,
    @Schema(
            description = "Keys that were already staged",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0")
        int alreadyStaged,
    @Schema(
            description = "Timestamp of the batch",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-10-31T15:30:00Z")
        Instant timestamp) {

  public static StageResultResponse from(StageResult stageResult) {
    return new StageResultResponse(
        stageResult.shardId(),
        stageResult.staged(),
        stageResult.alreadyStaged(),
        stageResult.timestamp());
  }
}
