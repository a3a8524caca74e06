package org.budgetanalyzer.changefeed.api;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.changefeed.api.response.FeedPageResponse;
import org.budgetanalyzer.changefeed.api.response.ShardStatusResponse;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.service.FeedReaderService;
import org.budgetanalyzer.changefeed.service.FeedStoreService;

@Tag(name = "Changefeed Handler", description = "Endpoints for reading a shard's feed")
@RestController
@RequestMapping(path = "/v1/changefeed/shards")
public class ChangefeedController {

  private static final Logger log = LoggerFactory.getLogger(ChangefeedController.class);

  private final FeedReaderService feedReaderService;
  private final FeedStoreService feedStoreService;

  public ChangefeedController(
      FeedReaderService feedReaderService, FeedStoreService feedStoreService) {
    this.feedReaderService = feedReaderService;
    this.feedStoreService = feedStoreService;
  }

  @Operation(
      summary = "Read the feed",
      description =
          "Returns the entries positioned after the cursor. Once the feed is exhausted the page is"
              + " topped up with provisional entries that are staged but not promoted; those do"
              + " not advance nextCursor. With waitMs the call first blocks until the feed moves"
              + " past the cursor or the wait elapses, then reads")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = FeedPageResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid cursor, page size or wait",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Invalid Cursor",
                          summary = "Cursor is not 32 hex characters",
                          value =
                              """
                      {
                        "type": "INVALID_REQUEST",
                        "message": "Cursor must be 32 hex characters, got 7",
                        "code": "INVALID_CURSOR"
                      }
                      """)
                    })),
        @ApiResponse(
            responseCode = "503",
            description = "Store unavailable, retry later",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/{shardId}/feed", produces = "application/json")
  public FeedPageResponse readFeed(
      @Parameter(description = "Shard to read", example = "0") @PathVariable int shardId,
      @Parameter(
              description = "Last position seen, as 32 hex characters; omit to read from the start",
              example = "0193a1b2c3d4e5f60718293a4b5c6d7e")
          @RequestParam(required = false)
          String cursor,
      @Parameter(description = "Maximum number of entries", example = "100")
          @RequestParam(required = false)
          Integer pageSize,
      @Parameter(
              description =
                  "Milliseconds to wait for entries after the cursor before reading; 0 reads at"
                      + " once",
              example = "20000")
          @RequestParam(required = false)
          Long waitMs) {
    log.debug(
        "Received readFeed request: shard={} cursor={} pageSize={} waitMs={}",
        shardId,
        cursor,
        pageSize,
        waitMs);

    var from = PositionToken.fromHex(cursor);
    if (waitMs != null && waitMs != 0) {
      feedReaderService.awaitChange(shardId, from, Duration.ofMillis(waitMs));
    }

    var page =
        feedReaderService.read(
            shardId, from, pageSize != null ? pageSize : feedReaderService.defaultPageSize());
    return FeedPageResponse.from(page);
  }

  @Operation(
      summary = "Get shard status",
      description = "Pending outbox rows, feed size and last promoted position of a shard")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ShardStatusResponse.class)))
      })
  @GetMapping(path = "/{shardId}", produces = "application/json")
  public ShardStatusResponse getShardStatus(
      @Parameter(description = "Shard to inspect", example = "0") @PathVariable int shardId) {
    return ShardStatusResponse.from(feedStoreService.getShardStatus(shardId));
  }
}
