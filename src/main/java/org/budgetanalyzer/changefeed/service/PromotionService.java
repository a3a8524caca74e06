package org.budgetanalyzer.changefeed.service;

import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import io.micrometer.core.instrument.MeterRegistry;

import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.domain.FeedEntryOrigin;
import org.budgetanalyzer.changefeed.domain.OutboxEntry;
import org.budgetanalyzer.changefeed.domain.PositionTimeSource;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.exception.InvalidRequestException;
import org.budgetanalyzer.changefeed.repository.OutboxEntryRepository;
import org.budgetanalyzer.changefeed.service.dto.PromotionResult;

/**
 * Moves staged outbox rows into a shard's feed.
 *
 * <p>A batch runs in one READ COMMITTED transaction:
 *
 * <ol>
 *   <li>lock the shard row, so promoters of the same shard run one after another
 *   <li>read up to {@code limit} outbox rows ordered by time hint, then insertion order
 *   <li>mint a position for each row, strictly after the shard's current maximum position, and
 *       append it through the dedup guard
 *   <li>delete the consumed rows and record the last promoted position on the shard row
 * </ol>
 *
 * <p>Minting under the shard lock and after the current maximum means a batch commits positions
 * that are all greater than anything a reader could already have seen, so readers never skip an
 * entry that commits late.
 *
 * <p><b>Retry safety:</b> a batch that fails rolls back completely and leaves its rows in the
 * outbox. A second promoter of the same shard waits for the lock and then finds the rows gone.
 * Rows whose key is already in the feed (backfilled, or re-staged after the key was promoted) are
 * counted as skipped and deleted.
 */
@Service
public class PromotionService {

  private static final Logger log = LoggerFactory.getLogger(PromotionService.class);

  private final OutboxEntryRepository outboxEntryRepository;
  private final FeedStoreService feedStoreService;
  private final PositionGenerator positionGenerator;
  private final ChangefeedServiceProperties properties;
  private final MeterRegistry meterRegistry;

  public PromotionService(
      OutboxEntryRepository outboxEntryRepository,
      FeedStoreService feedStoreService,
      PositionGenerator positionGenerator,
      ChangefeedServiceProperties properties,
      MeterRegistry meterRegistry) {
    this.outboxEntryRepository = outboxEntryRepository;
    this.feedStoreService = feedStoreService;
    this.positionGenerator = positionGenerator;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Promotes up to {@code limit} staged rows of a shard.
   *
   * @param shardId The shard to promote
   * @param limit Maximum number of outbox rows to consume
   * @return Counts of promoted and skipped rows and the last appended position
   * @throws InvalidRequestException if {@code limit} is outside {@code [1, max-batch-size]}
   */
  @Transactional(isolation = Isolation.READ_COMMITTED)
  public PromotionResult promoteBatch(int shardId, int limit) {
    validateLimit(limit);

    var shardState = feedStoreService.lockShard(shardId);
    var batch =
        outboxEntryRepository.findByShardIdOrderByTimeHintAscIdAsc(shardId, Limit.of(limit));
    var now = positionGenerator.now();

    if (batch.isEmpty()) {
      log.debug("Nothing to promote in shard {}", shardId);
      return new PromotionResult(shardId, 0, 0, null, now);
    }

    var timeSource = properties.getPromotion().getPositionTimeSource();
    var previous = feedStoreService.findMaxPosition(shardId).orElse(null);
    PositionToken lastPosition = null;
    var promoted = 0;

    for (var entry : batch) {
      var position = positionGenerator.mintAfter(mintingInstant(entry, timeSource, now), previous);
      var appended =
          feedStoreService.appendIfAbsent(
              shardId,
              position,
              entry.getAggregateId(),
              entry.getSequenceNumber(),
              FeedEntryOrigin.PROMOTION,
              now);
      if (appended) {
        promoted++;
        previous = position;
        lastPosition = position;
      }
    }

    outboxEntryRepository.deleteAllByIdInBatch(batch.stream().map(OutboxEntry::getId).toList());

    if (lastPosition != null) {
      shardState.setLastPromotedPosition(lastPosition);
      shardState.setLastPromotedAt(now);
    }

    var skipped = batch.size() - promoted;
    recordEntries(shardId, promoted, skipped);
    log.info(
        "Promoted shard {}: {} promoted, {} skipped, last position {}",
        shardId,
        promoted,
        skipped,
        lastPosition);

    return new PromotionResult(shardId, promoted, skipped, lastPosition, now);
  }

  /**
   * Lists the shards that have staged rows waiting for promotion.
   *
   * @return Shard ids in ascending order
   */
  @Transactional(readOnly = true)
  public List<Integer> findPendingShards() {
    return outboxEntryRepository.findShardsWithPendingEntries();
  }

  private Instant mintingInstant(OutboxEntry entry, PositionTimeSource timeSource, Instant now) {
    if (timeSource == PositionTimeSource.TIME_HINT) {
      return PositionToken.clamp(entry.getTimeHint());
    }
    return now;
  }

  private void validateLimit(int limit) {
    var max = properties.getPromotion().getMaxBatchSize();
    if (limit < 1 || limit > max) {
      throw new InvalidRequestException(
          "Promotion limit must be between 1 and " + max + ", got " + limit,
          ChangefeedServiceError.INVALID_BATCH_SIZE);
    }
  }

  private void recordEntries(int shardId, int promoted, int skipped) {
    var shard = String.valueOf(shardId);
    meterRegistry
        .counter("changefeed.promotion.entries", "shard", shard, "outcome", "promoted")
        .increment(promoted);
    meterRegistry
        .counter("changefeed.promotion.entries", "shard", shard, "outcome", "skipped")
        .increment(skipped);
  }
}
