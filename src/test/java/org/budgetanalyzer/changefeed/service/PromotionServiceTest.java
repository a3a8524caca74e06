package org.budgetanalyzer.changefeed.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Limit;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.budgetanalyzer.changefeed.config.ChangefeedServiceProperties;
import org.budgetanalyzer.changefeed.domain.FeedEntryOrigin;
import org.budgetanalyzer.changefeed.domain.PositionTimeSource;
import org.budgetanalyzer.changefeed.domain.PositionToken;
import org.budgetanalyzer.changefeed.domain.ShardState;
import org.budgetanalyzer.changefeed.exception.InvalidRequestException;
import org.budgetanalyzer.changefeed.fixture.OutboxEntryTestBuilder;
import org.budgetanalyzer.changefeed.fixture.TestConstants;
import org.budgetanalyzer.changefeed.repository.OutboxEntryRepository;

/**
 * Unit tests for {@link PromotionService}.
 *
 * <p>Minting uses a real {@link PositionGenerator} on a fixed clock; the stores are mocked. Locking
 * and the dedup guard against a real database are covered by the integration tests.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PromotionService Unit Tests")
class PromotionServiceTest {

  private static final int SHARD = TestConstants.SHARD;
  private static final Instant NOW = TestConstants.NOW;

  // ===========================================================================================
  // Test Dependencies
  // ===========================================================================================

  @Mock private OutboxEntryRepository outboxEntryRepository;

  @Mock private FeedStoreService feedStoreService;

  private MeterRegistry meterRegistry;

  private ChangefeedServiceProperties properties;

  private ShardState shardState;

  private PromotionService promotionService;

  // ===========================================================================================
  // Setup
  // ===========================================================================================

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    properties = new ChangefeedServiceProperties();
    properties.getPromotion().setMaxBatchSize(100);

    shardState = new ShardState();
    shardState.setShardId(SHARD);

    var positionGenerator = new PositionGenerator(Clock.fixed(NOW, ZoneOffset.UTC));
    promotionService =
        new PromotionService(
            outboxEntryRepository, feedStoreService, positionGenerator, properties, meterRegistry);
  }

  // ===========================================================================================
  // Test Cases - Promotion
  // ===========================================================================================

  @Test
  @DisplayName("promoteBatch - when outbox empty - returns empty result without deleting")
  void promoteBatch_WhenOutboxEmpty_ReturnsEmptyResult() {
    // Arrange
    when(feedStoreService.lockShard(SHARD)).thenReturn(shardState);
    when(outboxEntryRepository.findByShardIdOrderByTimeHintAscIdAsc(eq(SHARD), any(Limit.class)))
        .thenReturn(List.of());

    // Act
    var result = promotionService.promoteBatch(SHARD, 10);

    // Assert
    assertThat(result.isEmpty()).isTrue();
    assertThat(result.lastPosition()).isNull();
    verify(outboxEntryRepository, never()).deleteAllByIdInBatch(any());
    verify(feedStoreService, never()).findMaxPosition(anyInt());
    assertThat(shardState.getLastPromotedPosition()).isNull();
  }

  @Test
  @DisplayName("promoteBatch - appends rows in order with increasing positions after the feed max")
  void promoteBatch_AppendsRowsWithIncreasingPositions() {
    // Arrange
    var feedMax = PositionToken.of(NOW.toEpochMilli(), new byte[10]);
    var batch =
        List.of(
            OutboxEntryTestBuilder.anEntry().withId(1).withSequence(0).build(),
            OutboxEntryTestBuilder.anEntry().withId(2).withSequence(1).build(),
            OutboxEntryTestBuilder.anEntry().withId(3).withSequence(3).build());
    when(feedStoreService.lockShard(SHARD)).thenReturn(shardState);
    when(outboxEntryRepository.findByShardIdOrderByTimeHintAscIdAsc(eq(SHARD), any(Limit.class)))
        .thenReturn(batch);
    when(feedStoreService.findMaxPosition(SHARD)).thenReturn(Optional.of(feedMax));
    when(feedStoreService.appendIfAbsent(
            eq(SHARD),
            any(PositionToken.class),
            any(UUID.class),
            anyLong(),
            eq(FeedEntryOrigin.PROMOTION),
            eq(NOW)))
        .thenReturn(true);

    // Act
    var result = promotionService.promoteBatch(SHARD, 10);

    // Assert
    var positions = ArgumentCaptor.forClass(PositionToken.class);
    var sequences = ArgumentCaptor.forClass(Long.class);
    verify(feedStoreService, times(3))
        .appendIfAbsent(
            eq(SHARD),
            positions.capture(),
            eq(TestConstants.AGGREGATE_A),
            sequences.capture(),
            eq(FeedEntryOrigin.PROMOTION),
            eq(NOW));

    assertThat(sequences.getAllValues()).containsExactly(0L, 1L, 3L);
    assertThat(positions.getAllValues()).isSorted().doesNotHaveDuplicates();
    assertThat(positions.getAllValues().get(0)).isGreaterThan(feedMax);

    assertThat(result.promoted()).isEqualTo(3);
    assertThat(result.skipped()).isZero();
    assertThat(result.lastPosition()).isEqualTo(positions.getAllValues().get(2));

    verify(outboxEntryRepository).deleteAllByIdInBatch(List.of(1L, 2L, 3L));
    assertThat(shardState.getLastPromotedPosition()).isEqualTo(result.lastPosition());
    assertThat(shardState.getLastPromotedAt()).isEqualTo(NOW);
  }

  @Test
  @DisplayName("promoteBatch - keys already in the feed are skipped but still consumed")
  void promoteBatch_WhenKeyAlreadyInFeed_SkipsAndConsumes() {
    // Arrange
    var batch =
        List.of(
            OutboxEntryTestBuilder.anEntry().withId(1).withSequence(0).build(),
            OutboxEntryTestBuilder.anEntry().withId(2).withSequence(1).build());
    when(feedStoreService.lockShard(SHARD)).thenReturn(shardState);
    when(outboxEntryRepository.findByShardIdOrderByTimeHintAscIdAsc(eq(SHARD), any(Limit.class)))
        .thenReturn(batch);
    when(feedStoreService.findMaxPosition(SHARD)).thenReturn(Optional.empty());
    when(feedStoreService.appendIfAbsent(
            eq(SHARD),
            any(PositionToken.class),
            eq(TestConstants.AGGREGATE_A),
            eq(0L),
            eq(FeedEntryOrigin.PROMOTION),
            eq(NOW)))
        .thenReturn(false);
    when(feedStoreService.appendIfAbsent(
            eq(SHARD),
            any(PositionToken.class),
            eq(TestConstants.AGGREGATE_A),
            eq(1L),
            eq(FeedEntryOrigin.PROMOTION),
            eq(NOW)))
        .thenReturn(true);

    // Act
    var result = promotionService.promoteBatch(SHARD, 10);

    // Assert
    assertThat(result.promoted()).isEqualTo(1);
    assertThat(result.skipped()).isEqualTo(1);
    assertThat(result.consumed()).isEqualTo(2);
    verify(outboxEntryRepository).deleteAllByIdInBatch(List.of(1L, 2L));

    assertThat(
            meterRegistry
                .find("changefeed.promotion.entries")
                .tag("shard", "0")
                .tag("outcome", "promoted")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            meterRegistry
                .find("changefeed.promotion.entries")
                .tag("shard", "0")
                .tag("outcome", "skipped")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("promoteBatch - with TIME_HINT source - mints from hints without going backwards")
  void promoteBatch_WithTimeHintSource_MintsFromHintsMonotonically() {
    // Arrange
    properties.getPromotion().setPositionTimeSource(PositionTimeSource.TIME_HINT);
    var firstHint = NOW.minusSeconds(30);
    var olderHint = NOW.minusSeconds(60);
    var batch =
        List.of(
            OutboxEntryTestBuilder.anEntry()
                .withId(1)
                .withSequence(0)
                .withTimeHint(firstHint)
                .build(),
            OutboxEntryTestBuilder.anEntry()
                .withId(2)
                .withSequence(1)
                .withTimeHint(olderHint)
                .build());
    when(feedStoreService.lockShard(SHARD)).thenReturn(shardState);
    when(outboxEntryRepository.findByShardIdOrderByTimeHintAscIdAsc(eq(SHARD), any(Limit.class)))
        .thenReturn(batch);
    when(feedStoreService.findMaxPosition(SHARD)).thenReturn(Optional.empty());
    when(feedStoreService.appendIfAbsent(
            eq(SHARD),
            any(PositionToken.class),
            any(UUID.class),
            anyLong(),
            eq(FeedEntryOrigin.PROMOTION),
            eq(NOW)))
        .thenReturn(true);

    // Act
    promotionService.promoteBatch(SHARD, 10);

    // Assert
    var positions = ArgumentCaptor.forClass(PositionToken.class);
    verify(feedStoreService, times(2))
        .appendIfAbsent(
            eq(SHARD),
            positions.capture(),
            any(UUID.class),
            anyLong(),
            eq(FeedEntryOrigin.PROMOTION),
            eq(NOW));
    var first = positions.getAllValues().get(0);
    var second = positions.getAllValues().get(1);
    assertThat(first.timestamp()).isEqualTo(firstHint);
    assertThat(second).isGreaterThan(first);
    assertThat(second.timestamp()).isEqualTo(firstHint);
  }

  @Test
  @DisplayName("promoteBatch - with TIME_HINT source - a hint before the epoch mints at the epoch")
  void promoteBatch_WithTimeHintSource_ClampsHintBeforeEpoch() {
    // Arrange
    properties.getPromotion().setPositionTimeSource(PositionTimeSource.TIME_HINT);
    var batch =
        List.of(
            OutboxEntryTestBuilder.anEntry()
                .withId(1)
                .withSequence(0)
                .withTimeHint(Instant.parse("1969-07-20T20:17:00Z"))
                .build());
    when(feedStoreService.lockShard(SHARD)).thenReturn(shardState);
    when(outboxEntryRepository.findByShardIdOrderByTimeHintAscIdAsc(eq(SHARD), any(Limit.class)))
        .thenReturn(batch);
    when(feedStoreService.findMaxPosition(SHARD)).thenReturn(Optional.empty());
    when(feedStoreService.appendIfAbsent(
            eq(SHARD),
            any(PositionToken.class),
            any(UUID.class),
            anyLong(),
            eq(FeedEntryOrigin.PROMOTION),
            eq(NOW)))
        .thenReturn(true);

    // Act
    var result = promotionService.promoteBatch(SHARD, 10);

    // Assert
    assertThat(result.promoted()).isEqualTo(1);
    assertThat(result.lastPosition().timestamp()).isEqualTo(Instant.EPOCH);
  }

  // ===========================================================================================
  // Test Cases - Validation
  // ===========================================================================================

  @Test
  @DisplayName("promoteBatch - rejects a limit below one")
  void promoteBatch_WhenLimitZero_ThrowsInvalidRequest() {
    assertThatThrownBy(() -> promotionService.promoteBatch(SHARD, 0))
        .isInstanceOf(InvalidRequestException.class)
        .extracting(e -> ((InvalidRequestException) e).getError())
        .isEqualTo(ChangefeedServiceError.INVALID_BATCH_SIZE);
    verifyNoInteractions(feedStoreService, outboxEntryRepository);
  }

  @Test
  @DisplayName("promoteBatch - rejects a limit above the configured maximum")
  void promoteBatch_WhenLimitAboveMax_ThrowsInvalidRequest() {
    assertThatThrownBy(() -> promotionService.promoteBatch(SHARD, 101))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("between 1 and 100");
    verifyNoInteractions(feedStoreService, outboxEntryRepository);
  }
}
