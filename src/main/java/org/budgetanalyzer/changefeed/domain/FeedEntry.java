package org.budgetanalyzer.changefeed.domain;

import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * An entry of the canonical, ordered feed of a shard.
 *
 * <p>Two unique constraints carry the feed's invariants:
 *
 * <ul>
 *   <li>{@code (shard_id, position_token)} - a position identifies exactly one entry
 *   <li>{@code (shard_id, aggregate_id, sequence_number)} - an event appears at most once, whether
 *       it arrived through promotion or backfill
 * </ul>
 *
 * <p>Entries are written once and never updated or deleted by the service.
 */
@Entity
@Table(
    name = "changefeed_feed",
    uniqueConstraints = {
      @UniqueConstraint(columnNames = {"shard_id", "position_token"}),
      @UniqueConstraint(columnNames = {"shard_id", "aggregate_id", "sequence_number"})
    })
public class FeedEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "shard_id", nullable = false, updatable = false)
  private int shardId;

  @Column(name = "position_token", nullable = false, updatable = false, length = 16)
  private byte[] position;

  @Column(name = "aggregate_id", nullable = false, updatable = false)
  private UUID aggregateId;

  @Column(name = "sequence_number", nullable = false, updatable = false)
  private long sequenceNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "origin", nullable = false, updatable = false, length = 16)
  private FeedEntryOrigin origin;

  @Column(name = "promoted_at", nullable = false, updatable = false)
  private Instant promotedAt;

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

  public PositionToken getPosition() {
    return PositionToken.fromBytes(position);
  }

  public void setPosition(PositionToken position) {
    this.position = position.toBytes();
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

  public FeedEntryOrigin getOrigin() {
    return origin;
  }

  public void setOrigin(FeedEntryOrigin origin) {
    this.origin = origin;
  }

  public Instant getPromotedAt() {
    return promotedAt;
  }

  public void setPromotedAt(Instant promotedAt) {
    this.promotedAt = promotedAt;
  }
}
