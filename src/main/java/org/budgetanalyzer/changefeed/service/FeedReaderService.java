package org.budgetanalyzer.changefeed.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.exception.InvalidRequestException;
import org.budgetanalyzer.changefeed.repository.FeedEntryRepository;
import org.budgetanalyzer.changefeed.repository.OutboxEntryRepository;
import org.budgetanalyzer.changefeed.service.dto.FeedPage;
import org.budgetanalyzer.changefeed.service.dto.FeedPageEntry;

/**
 * Serves cursor-based pages of a shard's feed.
 *
 * <p>Each read runs in one read-only REPEATABLE READ transaction, so the feed page, the maximum
 * position check and the outbox fallback all see the same snapshot. Readers take no locks and never
 * block stagers, promoters or backfill.
 *
 * <p><b>Outbox fallback:</b> once a page reaches the end of the feed, the remaining capacity is
 * filled with staged rows that are not in the feed yet. Those entries are provisional: they carry
 * a presentation position and do not move the cursor, so the consumer sees them again, with the
 * same aggregate id and sequence, after they are promoted.
 *
 * <p><b>Long polling:</b> {@link #awaitChange} lets a caught-up reader block until the shard's feed
 * moves past its cursor, instead of re-reading in a tight loop.
 */
@Service
public class FeedReaderService {

  private static final Logger log = LoggerFactory.getLogger(FeedReaderService.class);

  private final FeedEntryRepository feedEntryRepository;
  private final OutboxEntryRepository outboxEntryRepository;
  private final ChangefeedServiceProperties properties;

  public FeedReaderService(
      FeedEntryRepository feedEntryRepository,
      OutboxEntryRepository outboxEntryRepository,
      ChangefeedServiceProperties properties) {
    this.feedEntryRepository = feedEntryRepository;
    this.outboxEntryRepository = outboxEntryRepository;
    this.properties = properties;
  }

  /**
   * Reads the page of a shard's feed that follows {@code cursor}.
   *
   * @param shardId The shard to read
   * @param cursor Last position the consumer has seen, null or zero for the beginning
   * @param pageSize Maximum number of entries, feed and provisional combined
   * @return The page and the cursor for the next call
   * @throws InvalidRequestException if {@code pageSize} is outside {@code [1, max-page-size]}
   */
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public FeedPage read(int shardId, PositionToken cursor, int pageSize) {
    validatePageSize(pageSize);
    var from = cursor != null ? cursor : PositionToken.zero();

    var feedEntries = feedEntryRepository.findPage(shardId, from.toBytes(), pageSize);
    var entries = new ArrayList<FeedPageEntry>(pageSize);
    feedEntries.forEach(feedEntry -> entries.add(FeedPageEntry.from(feedEntry)));

    var nextCursor =
        feedEntries.isEmpty() ? from : feedEntries.get(feedEntries.size() - 1).getPosition();

    if (entries.size() < pageSize
        && properties.getRead().isOutboxFallbackEnabled()
        && hasReachedEnd(shardId, nextCursor)) {
      var pending = outboxEntryRepository.findUnpromoted(shardId, pageSize - entries.size());
      pending.forEach(outboxEntry -> entries.add(FeedPageEntry.provisional(outboxEntry)));
      if (!pending.isEmpty()) {
        log.debug("Shard {} read includes {} provisional entries", shardId, pending.size());
      }
    }

    return new FeedPage(shardId, Collections.unmodifiableList(entries), nextCursor);
  }

  /**
   * Blocks until the shard's feed holds a position after {@code cursor}, or until {@code timeout}
   * has passed. Returns at once if it already does.
   *
   * <p>Returning tells the caller nothing: a change may or may not be available, and a timeout
   * looks the same as a wake-up. The caller always follows up with {@link #read}. The feed maximum
   * is checked every {@code read.long-poll-interval-ms}, each check in its own short read, so no
   * transaction or connection is held while waiting.
   *
   * <p>An interrupt ends the wait early and leaves the thread's interrupt flag set.
   *
   * @param shardId The shard to watch
   * @param cursor Last position the consumer has seen, null or zero for the beginning
   * @param timeout Longest time to wait, zero for a single check
   * @throws InvalidRequestException if {@code timeout} is negative or above {@code max-wait-ms}
   */
  public void awaitChange(int shardId, PositionToken cursor, Duration timeout) {
    validateWait(timeout);
    var from = cursor != null ? cursor : PositionToken.zero();
    var interval = properties.getRead().getLongPollIntervalMs();
    var deadline = System.nanoTime() + timeout.toNanos();

    while (!hasEntriesAfter(shardId, from)) {
      var remainingNanos = deadline - System.nanoTime();
      if (remainingNanos <= 0) {
        log.debug("Long poll on shard {} timed out after {}", shardId, timeout);
        return;
      }
      try {
        Thread.sleep(Math.min(interval, TimeUnit.NANOSECONDS.toMillis(remainingNanos) + 1));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.debug("Long poll on shard {} interrupted", shardId);
        return;
      }
    }
  }

  /**
   * Page size used when a reader does not choose one.
   *
   * @return The configured default page size
   */
  public int defaultPageSize() {
    return properties.getRead().getDefaultPageSize();
  }

  private boolean hasReachedEnd(int shardId, PositionToken cursor) {
    return feedEntryRepository
        .findFirstByShardIdOrderByPositionDesc(shardId)
        .map(last -> cursor.compareTo(last.getPosition()) >= 0)
        .orElse(true);
  }

  private boolean hasEntriesAfter(int shardId, PositionToken cursor) {
    return feedEntryRepository
        .findFirstByShardIdOrderByPositionDesc(shardId)
        .map(last -> last.getPosition().compareTo(cursor) > 0)
        .orElse(false);
  }

  private void validateWait(Duration timeout) {
    var max = properties.getRead().getMaxWaitMs();
    if (timeout.isNegative() || timeout.toMillis() > max) {
      throw new InvalidRequestException(
          "Wait must be between 0 and " + max + " ms, got " + timeout.toMillis(),
          ChangefeedServiceError.INVALID_WAIT);
    }
  }

  private void validatePageSize(int pageSize) {
    var max = properties.getRead().getMaxPageSize();
    if (pageSize < 1 || pageSize > max) {
      throw new InvalidRequestException(
          "Page size must be between 1 and " + max + ", got " + pageSize,
          ChangefeedServiceError.INVALID_PAGE_SIZE);
    }
  }
}
