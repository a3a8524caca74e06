package org.budgetanalyzer.changefeed.fixture;

import java.time.Instant;
import java.util.UUID;

import org.budgetanalyzer.changefeed.domain.FeedEntry;
import org.budgetanalyzer.changefeed.domain.FeedEntryOrigin;
import org.budgetanalyzer.changefeed.domain.PositionToken;

/** Builder for {@link FeedEntry} instances in unit tests. */
public final class FeedEntryTestBuilder {

  private int shardId = TestConstants.SHARD;
  private PositionToken position = PositionToken.zero();
  private UUID aggregateId = TestConstants.AGGREGATE_A;
  private long sequence;
  private FeedEntryOrigin origin = FeedEntryOrigin.PROMOTION;
  private Instant promotedAt = TestConstants.NOW;

  private FeedEntryTestBuilder() {}

  public static FeedEntryTestBuilder anEntry() {
    return new FeedEntryTestBuilder();
  }

  /** Position with the given millisecond and an all-zero suffix. */
  public FeedEntryTestBuilder atMillis(long epochMillis) {
    this.position = PositionToken.of(epochMillis, new byte[10]);
    return this;
  }

  public FeedEntryTestBuilder withPosition(PositionToken position) {
    this.position = position;
    return this;
  }

  public FeedEntryTestBuilder withAggregateId(UUID aggregateId) {
    this.aggregateId = aggregateId;
    return this;
  }

  public FeedEntryTestBuilder withSequence(long sequence) {
    this.sequence = sequence;
    return this;
  }

  public FeedEntry build() {
    var entry = new FeedEntry();
    entry.setShardId(shardId);
    entry.setPosition(position);
    entry.setAggregateId(aggregateId);
    entry.setSequenceNumber(sequence);
    entry.setOrigin(origin);
    entry.setPromotedAt(promotedAt);
    return entry;
  }
}
