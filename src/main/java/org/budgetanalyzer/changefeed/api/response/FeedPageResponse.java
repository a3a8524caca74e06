package org.budgetanalyzer.changefeed.api.response;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.changefeed.service.dto.FeedPage;

@Schema(description = "Page of a shard's feed")
public record FeedPageResponse(
    @Schema(description = "Shard read", requiredMode = Schema.RequiredMode.REQUIRED, example = "0")
        int shardId,
    @Schema(
            description = "Feed entries in position order, followed by provisional entries",
            requiredMode = Schema.RequiredMode.REQUIRED)
        List<FeedEntryResponse> entries,
    @Schema(
            description = "Cursor to pass on the next read",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0193a1b2c3d4e5f60718293a4b5c6d7e")
        String nextCursor) {

  public static FeedPageResponse from(FeedPage page) {
    return new FeedPageResponse(
        page.shardId(),
        page.entries().stream().map(FeedEntryResponse::from).toList(),
        page.nextCursor().toHex());
  }
}
