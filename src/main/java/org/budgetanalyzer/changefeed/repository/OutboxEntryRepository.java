package org.budgetanalyzer.changefeed.repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.budgetanalyzer.changefeed.domain.OutboxEntry;

/** Repository for staged, not yet promoted {@link OutboxEntry} rows. */
public interface OutboxEntryRepository extends JpaRepository<OutboxEntry, Long> {

  /**
   * Inserts an outbox row unless the shard already holds one for the same event key.
   *
   * @return 1 if a row was inserted, 0 if the key was already staged
   */
  @Modifying
  @Query(
      value =
          """
          INSERT INTO changefeed_outbox (shard_id, aggregate_id, sequence_number, time_hint)
          VALUES (:shardId, :aggregateId, :sequenceNumber, :timeHint)
          ON CONFLICT (shard_id, aggregate_id, sequence_number) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("shardId") int shardId,
      @Param("aggregateId") UUID aggregateId,
      @Param("sequenceNumber") long sequenceNumber,
      @Param("timeHint") Instant timeHint);

  /**
   * Reads the next rows of a shard to promote, oldest time hint first.
   *
   * @param shardId The shard to read
   * @param limit Maximum number of rows
   * @return Rows ordered by time hint, then insertion order
   */
  List<OutboxEntry> findByShardIdOrderByTimeHintAscIdAsc(int shardId, Limit limit);

  /**
   * Reads outbox rows whose event key is not in the feed yet.
   *
   * <p>Keys the feed already holds, typically through backfill, are excluded.
   *
   * @param shardId The shard to read
   * @param limit Maximum number of rows
   * @return Rows ordered by time hint, then insertion order
   */
  @Query(
      value =
          """
          SELECT o.* FROM changefeed_outbox o
          WHERE o.shard_id = :shardId
            AND NOT EXISTS (
              SELECT 1 FROM changefeed_feed f
              WHERE f.shard_id = o.shard_id
                AND f.aggregate_id = o.aggregate_id
                AND f.sequence_number = o.sequence_number)
          ORDER BY o.time_hint, o.id
          LIMIT :limit
          """,
      nativeQuery = true)
  List<OutboxEntry> findUnpromoted(@Param("shardId") int shardId, @Param("limit") int limit);

  /**
   * Lists the shards that currently have staged rows.
   *
   * @return Shard ids in ascending order
   */
  @Query("SELECT DISTINCT o.shardId FROM OutboxEntry o ORDER BY o.shardId")
  List<Integer> findShardsWithPendingEntries();

  long countByShardId(int shardId);
}
