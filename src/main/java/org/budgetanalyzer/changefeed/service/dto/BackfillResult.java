package org.budgetanalyzer.changefeed.service.dto;

import java.time.Instant;

/**
 * Outcome of a backfill batch.
 *
 * @param shardId The shard written to
 * @param inserted Items appended to the feed
 * @param skipped Items whose event key was already in the feed
 * @param timestamp When the batch ran
 */
public record BackfillResult(int shardId, int inserted, int skipped, Instant timestamp) {}
