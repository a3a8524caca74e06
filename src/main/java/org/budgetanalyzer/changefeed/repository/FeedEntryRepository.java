package org.budgetanalyzer.changefeed.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.budgetanalyzer.changefeed.domain.FeedEntry;

/**
 * Repository for the canonical feed.
 *
 * <p>Positions are stored as {@code bytea}, whose ordering matches {@link
 * org.budgetanalyzer.changefeed.domain.PositionToken#compareTo}, so range scans and sorting are
 * done by the database.
 */
public interface FeedEntryRepository extends JpaRepository<FeedEntry, Long> {

  /**
   * Appends a feed entry unless the shard already contains the same event key.
   *
   * <p>This single statement is the dedup guard shared by promotion and backfill.
   *
   * @return 1 if the entry was appended, 0 if the key was already present
   */
  @Modifying
  @Query(
      value =
          """
          INSERT INTO changefeed_feed
            (shard_id, position_token, aggregate_id, sequence_number, origin, promoted_at)
          VALUES
            (:shardId, :position, :aggregateId, :sequenceNumber, :origin, :promotedAt)
          ON CONFLICT (shard_id, aggregate_id, sequence_number) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("shardId") int shardId,
      @Param("position") byte[] position,
      @Param("aggregateId") UUID aggregateId,
      @Param("sequenceNumber") long sequenceNumber,
      @Param("origin") String origin,
      @Param("promotedAt") Instant promotedAt);

  /**
   * Reads the entries of a shard positioned strictly after a cursor.
   *
   * @param shardId The shard to read
   * @param cursor Raw 16-byte cursor, exclusive
   * @param limit Maximum number of entries
   * @return Entries in ascending position order
   */
  @Query(
      value =
          """
          SELECT * FROM changefeed_feed
          WHERE shard_id = :shardId AND position_token > :cursor
          ORDER BY position_token
          LIMIT :limit
          """,
      nativeQuery = true)
  List<FeedEntry> findPage(
      @Param("shardId") int shardId, @Param("cursor") byte[] cursor, @Param("limit") int limit);

  /**
   * Finds the entry with the highest position of a shard.
   *
   * @param shardId The shard to inspect
   * @return The last entry, or empty if the feed of the shard is empty
   */
  Optional<FeedEntry> findFirstByShardIdOrderByPositionDesc(int shardId);

  long countByShardId(int shardId);
}
