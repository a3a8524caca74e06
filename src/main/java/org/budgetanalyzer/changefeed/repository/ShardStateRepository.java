package org.budgetanalyzer.changefeed.repository;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.budgetanalyzer.changefeed.domain.ShardState;

/** Repository for {@link ShardState} rows. */
public interface ShardStateRepository extends JpaRepository<ShardState, Integer> {

  /**
   * Registers a shard. Registering an existing shard is a no-op.
   *
   * @return 1 if the shard was new, 0 otherwise
   */
  @Modifying
  @Query(
      value = "INSERT INTO changefeed_shard (shard_id) VALUES (:shardId) ON CONFLICT DO NOTHING",
      nativeQuery = true)
  int insertIfAbsent(@Param("shardId") int shardId);

  /**
   * Loads a shard row with {@code SELECT ... FOR UPDATE}, blocking until concurrent holders of the
   * same row commit or roll back.
   *
   * @param shardId The shard to lock
   * @return The locked row, or empty if the shard was never registered
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM ShardState s WHERE s.shardId = :shardId")
  Optional<ShardState> findForUpdate(@Param("shardId") int shardId);
}
