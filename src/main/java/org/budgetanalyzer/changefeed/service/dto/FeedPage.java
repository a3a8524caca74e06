package org.budgetanalyzer.changefeed.service.dto;

import java.util.List;

import org.budgetanalyzer.changefeed.domain.PositionToken;

/**
 * A page of a shard's feed.
 *
 * @param shardId The shard read
 * @param entries Feed entries in position order, followed by provisional entries if any
 * @param nextCursor Cursor for the next call; the last feed-sourced position of this page, or the
 *     request cursor when the page holds no feed-sourced entry
 */
public record FeedPage(int shardId, List<FeedPageEntry> entries, PositionToken nextCursor) {

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
