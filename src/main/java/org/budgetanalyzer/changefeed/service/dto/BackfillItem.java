package org.budgetanalyzer.changefeed.service.dto;

import java.time.Instant;
import java.util.UUID;

/** A historical event to insert into a shard's feed at its original point in time. */
public record BackfillItem(UUID aggregateId, long sequence, Instant originalInstant) {}
