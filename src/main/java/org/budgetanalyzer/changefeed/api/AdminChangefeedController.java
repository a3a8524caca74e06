package org.budgetanalyzer.changefeed.api;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.changefeed.api.request.BackfillRequest;
import org.budgetanalyzer.changefeed.api.request.StageRequest;
import org.budgetanalyzer.changefeed.api.response.BackfillResultResponse;
import org.budgetanalyzer.changefeed.api.response.PromotionResultResponse;
import org.budgetanalyzer.changefeed.api.response.StageResultResponse;
import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.service.BackfillService;
import org.budgetanalyzer.changefeed.service.OutboxStageService;
import org.budgetanalyzer.changefeed.service.PromotionService;

/** Admin endpoints for driving promotion, backfill and outbox repair by hand. */
@Tag(
    name = "Admin - Changefeed Handler",
    description = "Admin endpoints for promotion, backfill and outbox staging")
@RestController
@RequestMapping(path = "/v1/admin/changefeed/shards")
public class AdminChangefeedController {

  private static final Logger log = LoggerFactory.getLogger(AdminChangefeedController.class);

  private final PromotionService promotionService;
  private final BackfillService backfillService;
  private final OutboxStageService outboxStageService;
  private final ChangefeedServiceProperties properties;

  public AdminChangefeedController(
      PromotionService promotionService,
      BackfillService backfillService,
      OutboxStageService outboxStageService,
      ChangefeedServiceProperties properties) {
    this.promotionService = promotionService;
    this.backfillService = backfillService;
    this.outboxStageService = outboxStageService;
    this.properties = properties;
  }

  @Operation(
      summary = "Promote staged entries",
      description =
          "Promotes one batch of the shard's outbox into the feed - the same step the background"
              + " job runs")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = PromotionResultResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Limit out of range",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @PostMapping(path = "/{shardId}/promote", produces = "application/json")
  public PromotionResultResponse promote(
      @Parameter(description = "Shard to promote", example = "0") @PathVariable int shardId,
      @Parameter(description = "Maximum outbox rows to promote", example = "500")
          @RequestParam(required = false)
          Integer limit) {
    log.info("Received promote request: shard={} limit={}", shardId, limit);

    var result =
        promotionService.promoteBatch(
            shardId, limit != null ? limit : properties.getPromotion().getBatchSize());
    return PromotionResultResponse.from(result);
  }

  @Operation(
      summary = "Backfill historical events",
      description =
          "Inserts events at their original instant. Events already in the feed are skipped")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = BackfillResultResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Empty or oversized batch, or an instant in the future",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @PostMapping(path = "/{shardId}/backfill", produces = "application/json")
  public BackfillResultResponse backfill(
      @Parameter(description = "Shard to write to", example = "0") @PathVariable int shardId,
      @RequestBody @NotEmpty List<@Valid BackfillRequest> requests) {
    log.info("Received backfill request: shard={} items={}", shardId, requests.size());

    var items = requests.stream().map(BackfillRequest::toItem).toList();
    return BackfillResultResponse.from(backfillService.backfillBatch(shardId, items));
  }

  @Operation(
      summary = "Stage event keys",
      description =
          "Stages event keys in the shard's outbox, e.g. to repair writes whose staging was lost."
              + " Keys already staged are ignored")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = StageResultResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Empty or oversized batch",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @PostMapping(path = "/{shardId}/outbox", produces = "application/json")
  public StageResultResponse stage(
      @Parameter(description = "Shard to stage into", example = "0") @PathVariable int shardId,
      @RequestBody @NotEmpty List<@Valid StageRequest> requests) {
    log.info("Received stage request: shard={} items={}", shardId, requests.size());

    var items = requests.stream().map(StageRequest::toItem).toList();
    return StageResultResponse.from(outboxStageService.stageAll(shardId, items));
  }
}
