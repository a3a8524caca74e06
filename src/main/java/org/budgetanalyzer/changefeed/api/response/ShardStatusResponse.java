package org.budgetanalyzer.changefeed.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.service.dto.ShardStatus;

@Schema(description = "Progress of a shard")
public record ShardStatusResponse(
    @Schema(description = "Shard id", requiredMode = Schema.RequiredMode.REQUIRED, example = "0")
        int shardId,
    @Schema(
            description = "Staged outbox rows waiting for promotion",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "12")
        long pendingOutboxEntries,
    @Schema(
            description = "Entries in the feed",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1024")
        long feedEntries,
    @Schema(
            description = "Highest position in the feed",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "0193a1b2c3d4e5f60718293a4b5c6d7e")
        String maxPosition,
    @Schema(
            description = "Last position appended by promotion",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "0193a1b2c3d4e5f60718293a4b5c6d7e")
        String lastPromotedPosition,
    @Schema(
            description = "When the last non-empty promotion batch ran",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "2025-10-31T15:30:00Z")
        Instant lastPromotedAt) {

  public static ShardStatusResponse from(ShardStatus shardStatus) {
    return new ShardStatusResponse(
        shardStatus.shardId(),
        shardStatus.pendingOutboxEntries(),
        shardStatus.feedEntries(),
        toHex(shardStatus.maxPosition()),
        toHex(shardStatus.lastPromotedPosition()),
        shardStatus.lastPromotedAt());
  }

  private static String toHex(PositionToken position) {
    return position != null ? position.toHex() : null;
  }
}
