package org.budgetanalyzer.changefeed.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import io.micrometer.core.instrument.MeterRegistry;

import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.exception.InvalidRequestException;
import org.budgetanalyzer.changefeed.repository.OutboxEntryRepository;
import org.budgetanalyzer.changefeed.service.dto.StageItem;
import org.budgetanalyzer.changefeed.service.dto.StageResult;

/**
 * Captures domain writes into the outbox.
 *
 * <p>{@link #stage} joins the caller's transaction, so the outbox row commits or rolls back
 * together with the domain write it describes. There is no separate publish step that could fail
 * after the domain write committed.
 *
 * <p><b>Usage:</b>
 *
 * <pre>{@code
 * @Transactional
 * public void renameAccount(UUID accountId, String name) {
 *   var account = accountRepository.save(...);
 *   outboxStageService.stage(SHARD, accountId, account.getVersion(), null);
 * }
 * }</pre>
 */
@Service
public class OutboxStageService {

  private static final Logger log = LoggerFactory.getLogger(OutboxStageService.class);

  private final OutboxEntryRepository outboxEntryRepository;
  private final ChangefeedServiceProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public OutboxStageService(
      OutboxEntryRepository outboxEntryRepository,
      ChangefeedServiceProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.outboxEntryRepository = outboxEntryRepository;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Stages an event key in the caller's transaction.
   *
   * <p>Staging a key that is already staged in the shard creates nothing and is not an error.
   *
   * @param shardId Shard the event belongs to
   * @param aggregateId Aggregate of the event
   * @param sequence Sequence of the event within its aggregate
   * @param timeHint Write time, null for the current time; clamped into the range a position token
   *     can carry
   * @return true if a new outbox row was created
   * @throws org.springframework.transaction.IllegalTransactionStateException if no transaction is
   *     active
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public boolean stage(int shardId, UUID aggregateId, long sequence, Instant timeHint) {
    // Out-of-range hints are clamped, never rejected
    var hint = PositionToken.clamp(timeHint != null ? timeHint : clock.instant());

    var created = outboxEntryRepository.insertIfAbsent(shardId, aggregateId, sequence, hint) == 1;

    meterRegistry
        .counter("changefeed.outbox.staged", "outcome", created ? "staged" : "duplicate")
        .increment();
    log.debug(
        "Staged outbox entry: shard={} aggregateId={} sequence={} created={}",
        shardId,
        aggregateId,
        sequence,
        created);
    return created;
  }

  /**
   * Stages a list of event keys in one transaction of its own.
   *
   * <p>Meant for tooling that re-stages keys after a crash or an operator repair. Application code
   * writing domain records should call {@link #stage} inside its own transaction instead.
   *
   * @param shardId Shard the events belong to
   * @param items Keys to stage
   * @return Counts of new and already staged keys
   * @throws InvalidRequestException if the list is empty or longer than the configured batch size
   */
  @Transactional
  public StageResult stageAll(int shardId, List<StageItem> items) {
    validateBatchSize(items);

    var staged = 0;
    for (var item : items) {
      if (stage(shardId, item.aggregateId(), item.sequence(), item.timeHint())) {
        staged++;
      }
    }

    var alreadyStaged = items.size() - staged;
    log.info(
        "Staged {} outbox entries into shard {} ({} already staged)",
        staged,
        shardId,
        alreadyStaged);
    return new StageResult(shardId, staged, alreadyStaged, clock.instant());
  }

  private void validateBatchSize(List<StageItem> items) {
    var max = properties.getBackfill().getMaxBatchSize();
    if (items.isEmpty() || items.size() > max) {
      throw new InvalidRequestException(
          "Batch must contain between 1 and " + max + " items, got " + items.size(),
          ChangefeedServiceError.INVALID_BATCH_SIZE);
    }
  }
}
