package org.budgetanalyzer.changefeed.domain;

/** Which write path appended a feed entry. */
public enum FeedEntryOrigin {
  PROMOTION,
  BACKFILL
}
