package org.budgetanalyzer.changefeed.service.dto;

import java.time.Instant;

/**
 * Outcome of staging a list of event keys.
 *
 * @param shardId The shard staged into
 * @param staged Keys that created a new outbox row
 * @param alreadyStaged Keys the outbox already held
 * @param timestamp When the batch ran
 */
public record StageResult(int shardId, int staged, int alreadyStaged, Instant timestamp) {}
