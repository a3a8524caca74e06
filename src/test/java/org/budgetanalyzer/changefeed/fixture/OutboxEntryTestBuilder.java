package org.budgetanalyzer.changefeed.fixture;

import java.time.Instant;
import java.util.UUID;

import org.budgetanalyzer.changefeed.domain.OutboxEntry;

/** Builder for {@link OutboxEntry} instances in unit tests. */
public final class OutboxEntryTestBuilder {

  private Long id;
  private int shardId = TestConstants.SHARD;
  private UUID aggregateId = TestConstants.AGGREGATE_A;
  private long sequence;
  private Instant timeHint = TestConstants.NOW;

  private OutboxEntryTestBuilder() {}

  public static OutboxEntryTestBuilder anEntry() {
    return new OutboxEntryTestBuilder();
  }

  public OutboxEntryTestBuilder withId(long id) {
    this.id = id;
    return this;
  }

  public OutboxEntryTestBuilder withShardId(int shardId) {
    this.shardId = shardId;
    return this;
  }

  public OutboxEntryTestBuilder withAggregateId(UUID aggregateId) {
    this.aggregateId = aggregateId;
    return this;
  }

  public OutboxEntryTestBuilder withSequence(long sequence) {
    this.sequence = sequence;
    return this;
  }

  public OutboxEntryTestBuilder withTimeHint(Instant timeHint) {
    this.timeHint = timeHint;
    return this;
  }

  public OutboxEntry build() {
    var entry = new OutboxEntry();
    entry.setId(id);
    entry.setShardId(shardId);
    entry.setAggregateId(aggregateId);
    entry.setSequenceNumber(sequence);
    entry.setTimeHint(timeHint);
    return entry;
  }
}
