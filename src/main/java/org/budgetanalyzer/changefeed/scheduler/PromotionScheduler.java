package org.budgetanalyzer.changefeed.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.service.PromotionService;

/**
 * Background driver for promotion.
 *
 * <p>Every run lists the shards with staged rows and drains each one in batches of {@code
 * promotion.batch-size}, moving on after {@code promotion.max-batches-per-run} batches so that one
 * busy shard cannot starve the others. A shard that fails is logged and left for the next run;
 * its failed batch has rolled back and nothing is retried within the run.
 */
@Component
@ConditionalOnProperty(
    prefix = "changefeed-service.promotion",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PromotionScheduler {

  private static final Logger log = LoggerFactory.getLogger(PromotionScheduler.class);

  private final MeterRegistry meterRegistry;
  private final ChangefeedServiceProperties properties;
  private final PromotionService promotionService;

  public PromotionScheduler(
      MeterRegistry meterRegistry,
      ChangefeedServiceProperties properties,
      PromotionService promotionService) {
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.promotionService = promotionService;
  }

  @Scheduled(fixedDelayString = "${changefeed-service.promotion.fixed-delay-ms:1000}")
  @SchedulerLock(name = "changefeedPromotion")
  public void promotePendingShards() {
    var sample = Timer.start(meterRegistry);

    Exception firstFailure = null;
    var shards = 0;
    var promoted = 0;
    try {
      for (var shardId : promotionService.findPendingShards()) {
        shards++;
        try {
          promoted += drainShard(shardId);
        } catch (Exception e) {
          log.error("Failed to promote shard {}: {}", shardId, e.getMessage(), e);
          if (firstFailure == null) {
            firstFailure = e;
          }
        }
      }
    } catch (Exception e) {
      log.error("Failed to list shards pending promotion: {}", e.getMessage(), e);
      firstFailure = e;
    }

    if (firstFailure == null) {
      if (promoted > 0) {
        log.info("Promotion run complete: {} entries promoted across {} shards", promoted, shards);
      }
      recordSuccess(sample);
    } else {
      recordFailure(sample, firstFailure);
    }
  }

  private int drainShard(int shardId) {
    var promotion = properties.getPromotion();
    var promoted = 0;

    for (int batch = 0; batch < promotion.getMaxBatchesPerRun(); batch++) {
      var result = promotionService.promoteBatch(shardId, promotion.getBatchSize());
      promoted += result.promoted();
      if (result.consumed() < promotion.getBatchSize()) {
        return promoted;
      }
    }

    log.debug(
        "Shard {} still has pending entries after {} batches, continuing next run",
        shardId,
        promotion.getMaxBatchesPerRun());
    return promoted;
  }

  private void recordSuccess(Timer.Sample sample) {
    sample.stop(
        Timer.builder("changefeed.promotion.duration")
            .tag("status", "success")
            .register(meterRegistry));

    meterRegistry.counter("changefeed.promotion.executions", "status", "success").increment();
  }

  private void recordFailure(Timer.Sample sample, Exception e) {
    sample.stop(
        Timer.builder("changefeed.promotion.duration")
            .tag("status", "failure")
            .tag("error", e.getClass().getSimpleName())
            .register(meterRegistry));

    meterRegistry
        .counter(
            "changefeed.promotion.executions",
            "status",
            "failure",
            "error",
            e.getClass().getSimpleName())
        .increment();
  }
}
