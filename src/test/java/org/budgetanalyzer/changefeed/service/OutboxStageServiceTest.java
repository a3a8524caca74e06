package org.budgetanalyzer.changefeed.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.exception.InvalidRequestException;
import org.budgetanalyzer.changefeed.fixture.TestConstants;
import org.budgetanalyzer.changefeed.repository.OutboxEntryRepository;
import org.budgetanalyzer.changefeed.service.dto.StageItem;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxStageService Unit Tests")
class OutboxStageServiceTest {

  private static final int SHARD = TestConstants.SHARD;
  private static final Instant NOW = TestConstants.NOW;
  private static final UUID AGGREGATE = TestConstants.AGGREGATE_A;

  @Mock private OutboxEntryRepository outboxEntryRepository;

  private SimpleMeterRegistry meterRegistry;

  private OutboxStageService outboxStageService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    outboxStageService =
        new OutboxStageService(
            outboxEntryRepository,
            new ChangefeedServiceProperties(),
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("stage - null time hint defaults to now")
  void stage_WhenTimeHintNull_UsesClock() {
    when(outboxEntryRepository.insertIfAbsent(SHARD, AGGREGATE, 1L, NOW)).thenReturn(1);

    assertThat(outboxStageService.stage(SHARD, AGGREGATE, 1L, null)).isTrue();
    verify(outboxEntryRepository).insertIfAbsent(SHARD, AGGREGATE, 1L, NOW);
  }

  @Test
  @DisplayName("stage - second staging of a key is a no-op, not an error")
  void stage_WhenAlreadyStaged_ReturnsFalse() {
    var hint = NOW.minusSeconds(1);
    when(outboxEntryRepository.insertIfAbsent(SHARD, AGGREGATE, 1L, hint)).thenReturn(1, 0);

    assertThat(outboxStageService.stage(SHARD, AGGREGATE, 1L, hint)).isTrue();
    assertThat(outboxStageService.stage(SHARD, AGGREGATE, 1L, hint)).isFalse();

    assertThat(
            meterRegistry
                .find("changefeed.outbox.staged")
                .tag("outcome", "staged")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            meterRegistry
                .find("changefeed.outbox.staged")
                .tag("outcome", "duplicate")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("stage - time hint before the epoch is clamped to the epoch, not rejected")
  void stage_WhenTimeHintBeforeEpoch_ClampsToEpoch() {
    when(outboxEntryRepository.insertIfAbsent(SHARD, AGGREGATE, 1L, Instant.EPOCH)).thenReturn(1);

    var created =
        outboxStageService.stage(SHARD, AGGREGATE, 1L, Instant.parse("1969-12-31T23:59:59Z"));

    assertThat(created).isTrue();
    verify(outboxEntryRepository).insertIfAbsent(SHARD, AGGREGATE, 1L, Instant.EPOCH);
  }

  @Test
  @DisplayName("stage - time hint past the position range is clamped to the range limit")
  void stage_WhenTimeHintBeyondRange_ClampsToLimit() {
    var limit = Instant.ofEpochMilli(PositionToken.MAX_TIMESTAMP_MILLIS);
    when(outboxEntryRepository.insertIfAbsent(SHARD, AGGREGATE, 1L, limit)).thenReturn(1);

    var created = outboxStageService.stage(SHARD, AGGREGATE, 1L, Instant.MAX);

    assertThat(created).isTrue();
    verify(outboxEntryRepository).insertIfAbsent(SHARD, AGGREGATE, 1L, limit);
  }

  @Test
  @DisplayName("stageAll - counts new and already staged keys")
  void stageAll_CountsNewAndAlreadyStaged() {
    when(outboxEntryRepository.insertIfAbsent(eq(SHARD), eq(AGGREGATE), anyLong(), any()))
        .thenReturn(1, 0, 1);

    var result =
        outboxStageService.stageAll(
            SHARD,
            List.of(
                new StageItem(AGGREGATE, 1L, null),
                new StageItem(AGGREGATE, 1L, null),
                new StageItem(AGGREGATE, 2L, NOW.minusSeconds(3))));

    assertThat(result.staged()).isEqualTo(2);
    assertThat(result.alreadyStaged()).isEqualTo(1);
    assertThat(result.timestamp()).isEqualTo(NOW);
  }

  @Test
  @DisplayName("stageAll - rejects an empty list")
  void stageAll_WhenEmpty_ThrowsInvalidRequest() {
    assertThatThrownBy(() -> outboxStageService.stageAll(SHARD, List.of()))
        .isInstanceOf(InvalidRequestException.class);
    verifyNoInteractions(outboxEntryRepository);
  }
}
