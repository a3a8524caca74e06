package org.budgetanalyzer.changefeed.service.dto;

import java.time.Instant;
import java.util.UUID;

/** An event key to stage in the outbox; a null time hint means "now". */
public record StageItem(UUID aggregateId, long sequence, Instant timeHint) {}
