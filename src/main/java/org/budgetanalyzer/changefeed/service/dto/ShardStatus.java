package org.budgetanalyzer.changefeed.service.dto;

import java.time.Instant;

import org.budgetanalyzer.changefeed.domain.PositionToken;

/**
 * Snapshot of a shard's progress.
 *
 * @param shardId The shard
 * @param pendingOutboxEntries Staged rows not promoted yet
 * @param feedEntries Entries in the feed
 * @param maxPosition Highest position in the feed, null if the feed is empty
 * @param lastPromotedPosition Last position appended by promotion, null if none
 * @param lastPromotedAt When the last non-empty promotion batch committed, null if none
 */
public record ShardStatus(
    int shardId,
    long pendingOutboxEntries,
    long feedEntries,
    PositionToken maxPosition,
    PositionToken lastPromotedPosition,
    Instant lastPromotedAt) {}
