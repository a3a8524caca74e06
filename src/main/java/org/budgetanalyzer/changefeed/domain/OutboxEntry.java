package org.budgetanalyzer.changefeed.domain;

import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * A captured write waiting to be promoted into the feed.
 *
 * <p>Rows are inserted with {@code INSERT ... ON CONFLICT DO NOTHING} inside the domain write's
 * transaction, so a key is staged at most once per shard. Promotion deletes the rows it consumes.
 */
@Entity
@Table(
    name = "changefeed_outbox",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"shard_id", "aggregate_id", "sequence_number"}))
public class OutboxEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "shard_id", nullable = false)
  private int shardId;

  @Column(name = "aggregate_id", nullable = false)
  private UUID aggregateId;

  @Column(name = "sequence_number", nullable = false)
  private long sequenceNumber;

  /** Informational write time; orders provisional reads and, optionally, promotion. */
  @Column(name = "time_hint", nullable = false)
  private Instant timeHint;

  @Column(name = "created_at", nullable = false, insertable = false, updatable = false)
  private Instant createdAt;

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public int getShardId() {
    return shardId;
  }

  public void setShardId(int shardId) {
    this.shardId = shardId;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }

  public void setAggregateId(UUID aggregateId) {
    this.aggregateId = aggregateId;
  }

  public long getSequenceNumber() {
    return sequenceNumber;
  }

  public void setSequenceNumber(long sequenceNumber) {
    this.sequenceNumber = sequenceNumber;
  }

  public Instant getTimeHint() {
    return timeHint;
  }

  public void setTimeHint(Instant timeHint) {
    this.timeHint = timeHint;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
