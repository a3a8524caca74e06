package org.budgetanalyzer.changefeed.service.dto;

import java.time.Instant;

import org.budgetanalyzer.changefeed.domain.PositionToken;

/**
 * Outcome of one promotion batch.
 *
 * <p>{@code promoted + skipped} is the number of outbox rows the batch consumed. Skipped rows were
 * already in the feed, through an earlier promotion or through backfill.
 *
 * @param shardId The promoted shard
 * @param promoted Rows appended to the feed
 * @param skipped Rows whose event key was already in the feed
 * @param lastPosition Highest position appended by this batch, null if nothing was appended
 * @param timestamp When the batch ran
 */
public record PromotionResult(
    int shardId, int promoted, int skipped, PositionToken lastPosition, Instant timestamp) {

  /** Number of outbox rows consumed by the batch. */
  public int consumed() {
    return promoted + skipped;
  }

  /** Whether the batch found nothing to promote. */
  public boolean isEmpty() {
    return consumed() == 0;
  }
}
