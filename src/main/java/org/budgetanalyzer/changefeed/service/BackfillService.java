package org.budgetanalyzer.changefeed.service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.micrometer.core.instrument.MeterRegistry;

import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.domain.FeedEntryOrigin;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.exception.InvalidRequestException;
import org.budgetanalyzer.changefeed.service.dto.BackfillItem;
import org.budgetanalyzer.changefeed.service.dto.BackfillResult;

/**
 * Inserts historical events into a shard's feed at their original point in time.
 *
 * <p>Positions are minted from each event's original instant, so backfilled history sorts before
 * live entries promoted after it. Backfill appends through the same dedup guard as promotion and
 * does not take the shard lock: a key that promotion appended first is skipped here, and a key
 * appended here first is skipped by promotion.
 *
 * <p>Backfill is driven by an external process that walks the record store in small batches; each
 * call is one short transaction.
 *
 * <p>A batch here and a promotion batch that insert overlapping keys in different orders can
 * deadlock on the feed's unique index. PostgreSQL aborts one of them, which surfaces as a
 * {@link org.springframework.dao.PessimisticLockingFailureException}; the aborted batch rolled
 * back whole and can be retried. Backfill is meant for history that is not also being staged, so
 * callers keep it off keys that may still sit in the outbox.
 */
@Service
public class BackfillService {

  private static final Logger log = LoggerFactory.getLogger(BackfillService.class);

  private final FeedStoreService feedStoreService;
  private final PositionGenerator positionGenerator;
  private final ChangefeedServiceProperties properties;
  private final MeterRegistry meterRegistry;

  public BackfillService(
      FeedStoreService feedStoreService,
      PositionGenerator positionGenerator,
      ChangefeedServiceProperties properties,
      MeterRegistry meterRegistry) {
    this.feedStoreService = feedStoreService;
    this.positionGenerator = positionGenerator;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Inserts one historical event.
   *
   * @param shardId Shard the event belongs to
   * @param aggregateId Aggregate of the event
   * @param sequence Sequence of the event within its aggregate
   * @param originalInstant When the event originally happened
   * @return true if the event was appended, false if its key was already in the feed
   * @throws InvalidRequestException if {@code originalInstant} is in the future or before the epoch
   */
  @Transactional
  public boolean backfill(int shardId, UUID aggregateId, long sequence, Instant originalInstant) {
    var now = positionGenerator.now();
    validateInstant(originalInstant, now);

    var appended =
        feedStoreService.appendIfAbsent(
            shardId,
            positionGenerator.mint(originalInstant),
            aggregateId,
            sequence,
            FeedEntryOrigin.BACKFILL,
            now);
    recordEntries(shardId, appended ? 1 : 0, appended ? 0 : 1);
    return appended;
  }

  /**
   * Inserts a batch of historical events in one transaction.
   *
   * <p>Items are positioned in order of their original instant; items sharing an instant keep their
   * order in the request.
   *
   * @param shardId Shard the events belong to
   * @param items Events to insert
   * @return Counts of inserted and skipped items
   * @throws InvalidRequestException if the batch is empty, too large, or holds an invalid instant;
   *     nothing is inserted in that case
   */
  @Transactional
  public BackfillResult backfillBatch(int shardId, List<BackfillItem> items) {
    validateBatchSize(items);
    var now = positionGenerator.now();
    items.forEach(item -> validateInstant(item.originalInstant(), now));

    var ordered =
        items.stream().sorted(Comparator.comparing(BackfillItem::originalInstant)).toList();

    PositionToken previous = null;
    var inserted = 0;
    for (var item : ordered) {
      var position = positionGenerator.mintAfter(item.originalInstant(), previous);
      var appended =
          feedStoreService.appendIfAbsent(
              shardId,
              position,
              item.aggregateId(),
              item.sequence(),
              FeedEntryOrigin.BACKFILL,
              now);
      if (appended) {
        inserted++;
        previous = position;
      }
    }

    var skipped = items.size() - inserted;
    recordEntries(shardId, inserted, skipped);
    log.info("Backfilled shard {}: {} inserted, {} skipped", shardId, inserted, skipped);

    return new BackfillResult(shardId, inserted, skipped, now);
  }

  private void validateInstant(Instant originalInstant, Instant now) {
    if (originalInstant == null) {
      throw new InvalidRequestException(
          "Original instant is required", ChangefeedServiceError.INVALID_BACKFILL_INSTANT);
    }
    if (originalInstant.isAfter(now)) {
      throw new InvalidRequestException(
          "Original instant " + originalInstant + " is in the future",
          ChangefeedServiceError.INVALID_BACKFILL_INSTANT);
    }
    if (!PositionToken.isRepresentable(originalInstant)) {
      throw new InvalidRequestException(
          "Original instant " + originalInstant + " is before " + Instant.EPOCH,
          ChangefeedServiceError.INVALID_BACKFILL_INSTANT);
    }
  }

  private void validateBatchSize(List<BackfillItem> items) {
    var max = properties.getBackfill().getMaxBatchSize();
    if (items.isEmpty() || items.size() > max) {
      throw new InvalidRequestException(
          "Backfill batch must contain between 1 and " + max + " items, got " + items.size(),
          ChangefeedServiceError.INVALID_BATCH_SIZE);
    }
  }

  private void recordEntries(int shardId, int inserted, int skipped) {
    var shard = String.valueOf(shardId);
    meterRegistry
        .counter("changefeed.backfill.entries", "shard", shard, "outcome", "inserted")
        .increment(inserted);
    meterRegistry
        .counter("changefeed.backfill.entries", "shard", shard, "outcome", "skipped")
        .increment(skipped);
  }
}
