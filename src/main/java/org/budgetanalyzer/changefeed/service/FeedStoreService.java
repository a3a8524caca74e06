package org.budgetanalyzer.changefeed.service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import org.budgetanalyzer.changefeed.domain.FeedEntry;
import org.budgetanalyzer.changefeed.domain.FeedEntryOrigin;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.domain.ShardState;
import org.budgetanalyzer.changefeed.repository.FeedEntryRepository;
import org.budgetanalyzer.changefeed.repository.OutboxEntryRepository;
import org.budgetanalyzer.changefeed.repository.ShardStateRepository;
import org.budgetanalyzer.changefeed.service.dto.ShardStatus;

/**
 * Owns the canonical feed and the per-shard bookkeeping rows.
 *
 * <p>All writes into the feed go through {@link #appendIfAbsent}, whose single {@code INSERT ...
 * ON CONFLICT DO NOTHING} statement is what makes promotion and backfill safe to run concurrently
 * over the same event keys: whichever commits first wins and the other observes a no-op.
 */
@Service
public class FeedStoreService {

  private static final Logger log = LoggerFactory.getLogger(FeedStoreService.class);

  private final FeedEntryRepository feedEntryRepository;
  private final OutboxEntryRepository outboxEntryRepository;
  private final ShardStateRepository shardStateRepository;

  public FeedStoreService(
      FeedEntryRepository feedEntryRepository,
      OutboxEntryRepository outboxEntryRepository,
      ShardStateRepository shardStateRepository) {
    this.feedEntryRepository = feedEntryRepository;
    this.outboxEntryRepository = outboxEntryRepository;
    this.shardStateRepository = shardStateRepository;
  }

  /**
   * Registers a shard if it is not registered yet.
   *
   * @param shardId The shard to register
   * @return true if this call created the shard row
   */
  @Transactional
  public boolean ensureShard(int shardId) {
    var created = shardStateRepository.insertIfAbsent(shardId) == 1;
    if (created) {
      log.info("Registered shard {}", shardId);
    }
    return created;
  }

  /**
   * Registers the shard if needed and locks its row until the surrounding transaction ends.
   *
   * <p>Concurrent callers for the same shard block here, so whatever they do next under the lock
   * is serialized per shard. Other shards are not affected.
   *
   * @param shardId The shard to lock
   * @return The locked, managed shard row
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public ShardState lockShard(int shardId) {
    ensureShard(shardId);
    return shardStateRepository
        .findForUpdate(shardId)
        .orElseThrow(
            () -> new IllegalStateException("Shard " + shardId + " vanished after registration"));
  }

  /**
   * Appends an entry to a shard's feed unless the shard already holds the same event key.
   *
   * @param shardId The shard to append to
   * @param position Position of the new entry, unique within the shard
   * @param aggregateId Aggregate of the event
   * @param sequence Sequence of the event within its aggregate
   * @param origin Write path the entry comes from
   * @param appendedAt Recorded as the entry's promotion time
   * @return true if the entry was appended, false if the key was already present
   */
  @Transactional
  public boolean appendIfAbsent(
      int shardId,
      PositionToken position,
      UUID aggregateId,
      long sequence,
      FeedEntryOrigin origin,
      Instant appendedAt) {
    var appended =
        feedEntryRepository.insertIfAbsent(
                shardId, position.toBytes(), aggregateId, sequence, origin.name(), appendedAt)
            == 1;
    if (appended) {
      log.debug(
          "Appended {} entry: shard={} aggregateId={} sequence={} position={}",
          origin,
          shardId,
          aggregateId,
          sequence,
          position);
    } else {
      log.debug(
          "Skipped {} entry already in feed: shard={} aggregateId={} sequence={}",
          origin,
          shardId,
          aggregateId,
          sequence);
    }
    return appended;
  }

  /**
   * Returns the highest position in a shard's feed.
   *
   * @param shardId The shard to inspect
   * @return The maximum position, or empty if the feed is empty
   */
  @Transactional(readOnly = true)
  public Optional<PositionToken> findMaxPosition(int shardId) {
    return feedEntryRepository
        .findFirstByShardIdOrderByPositionDesc(shardId)
        .map(FeedEntry::getPosition);
  }

  /**
   * Reports pending and promoted counts of a shard. An unknown shard reports zeros.
   *
   * @param shardId The shard to inspect
   * @return The shard's status
   */
  @Transactional(readOnly = true)
  public ShardStatus getShardStatus(int shardId) {
    var shardState = shardStateRepository.findById(shardId);
    return new ShardStatus(
        shardId,
        outboxEntryRepository.countByShardId(shardId),
        feedEntryRepository.countByShardId(shardId),
        findMaxPosition(shardId).orElse(null),
        shardState.map(ShardState::getLastPromotedPosition).orElse(null),
        shardState.map(ShardState::getLastPromotedAt).orElse(null));
  }
}
