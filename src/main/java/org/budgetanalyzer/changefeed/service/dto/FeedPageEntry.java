package org.budgetanalyzer.changefeed.service.dto;

import java.time.Instant;
import java.util.UUID;

import org.budgetanalyzer.changefeed.domain.FeedEntry;
import org.budgetanalyzer.changefeed.domain.OutboxEntry;
import org.budgetanalyzer.changefeed.domain.PositionToken;

/**
 * One event of a feed page.
 *
 * <p>Provisional entries come from the outbox: their position is a presentation token that is not
 * stored anywhere and must not be used as a cursor, and {@code timestamp} is the staging time hint.
 * For feed entries {@code timestamp} is the time the entry was appended.
 */
public record FeedPageEntry(
    PositionToken position,
    UUID aggregateId,
    long sequence,
    Instant timestamp,
    boolean provisional) {

  public static FeedPageEntry from(FeedEntry feedEntry) {
    return new FeedPageEntry(
        feedEntry.getPosition(),
        feedEntry.getAggregateId(),
        feedEntry.getSequenceNumber(),
        feedEntry.getPromotedAt(),
        false);
  }

  public static FeedPageEntry provisional(OutboxEntry outboxEntry) {
    return new FeedPageEntry(
        PositionToken.provisional(
            outboxEntry.getTimeHint(),
            outboxEntry.getAggregateId(),
            outboxEntry.getSequenceNumber()),
        outboxEntry.getAggregateId(),
        outboxEntry.getSequenceNumber(),
        outboxEntry.getTimeHint(),
        true);
  }
}
