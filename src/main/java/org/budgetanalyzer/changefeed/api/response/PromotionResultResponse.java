package org.budgetanalyzer.changefeed.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.service.dto.PromotionResult;

@Schema(description = "Outcome of a promotion batch")
public record PromotionResultResponse(
    @Schema(
            description = "Promoted shard",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0")
        int shardId,
    @Schema(
            description = "Outbox rows appended to the feed",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "42")
        int promoted,
    @Schema(
            description = "Outbox rows whose event was already in the feed",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        int skipped,
    @Schema(
            description = "Highest position appended by the batch",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "0193a1b2c3d4e5f60718293a4b5c6d7e")
        String lastPosition,
    @Schema(
            description = "Timestamp of the batch",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-10-31T15:30:00Z")
        Instant timestamp) {

  public static PromotionResultResponse from(PromotionResult promotionResult) {
    return new PromotionResultResponse(
        promotionResult.shardId(),
        promotionResult.promoted(),
        promotionResult.skipped(),
        promotionResult.lastPosition() != null ? promotionResult.lastPosition().toHex() : null,
        promotionResult.timestamp());
  }
}
