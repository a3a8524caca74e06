package org.budgetanalyzer.changefeed.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Per-shard bookkeeping row.
 *
 * <p>The row doubles as the promotion lock of its shard: promoters take {@code SELECT ... FOR
 * UPDATE} on it, so positions of one shard are minted and committed in order while other shards,
 * stagers, backfill and readers proceed untouched.
 */
@Entity
@Table(name = "changefeed_shard")
public class ShardState {

  @Id
  @Column(name = "shard_id")
  private Integer shardId;

  @Column(name = "last_promoted_position", length = 16)
  private byte[] lastPromotedPosition;

  @Column(name = "last_promoted_at")
  private Instant lastPromotedAt;

  @Column(name = "created_at", nullable = false, insertable = false, updatable = false)
  private Instant createdAt;

  public Integer getShardId() {
    return shardId;
  }

  public void setShardId(Integer shardId) {
    this.shardId = shardId;
  }

  /** Returns the last position appended by promotion, or null if nothing was promoted yet. */
  public PositionToken getLastPromotedPosition() {
    return lastPromotedPosition == null ? null : PositionToken.fromBytes(lastPromotedPosition);
  }

  public void setLastPromotedPosition(PositionToken lastPromotedPosition) {
    this.lastPromotedPosition =
        lastPromotedPosition == null ? null : lastPromotedPosition.toBytes();
  }

  public Instant getLastPromotedAt() {
    return lastPromotedAt;
  }

  public void setLastPromotedAt(Instant lastPromotedAt) {
    this.lastPromotedAt = lastPromotedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
