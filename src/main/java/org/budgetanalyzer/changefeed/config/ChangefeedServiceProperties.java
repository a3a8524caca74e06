package org.budgetanalyzer.changefeed.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import org.budgetanalyzer.changefeed.domain.PositionTimeSource;

@ConfigurationProperties(prefix = "changefeed-service")
@Validated
public class ChangefeedServiceProperties {

  @Valid private Promotion promotion = new Promotion();
  @Valid private Read read = new Read();
  @Valid private Backfill backfill = new Backfill();

  public Promotion getPromotion() {
    return promotion;
  }

  public void setPromotion(Promotion promotion) {
    this.promotion = promotion;
  }

  public Read getRead() {
    return read;
  }

  public void setRead(Read read) {
    this.read = read;
  }

  public Backfill getBackfill() {
    return backfill;
  }

  public void setBackfill(Backfill backfill) {
    this.backfill = backfill;
  }

  public static class Promotion {

    /** Whether the background promotion job runs on this instance. */
    private boolean enabled = true;

    /** Delay between the end of one promotion run and the start of the next. */
    @Min(10)
    private long fixedDelayMs = 1000;

    /** Outbox rows promoted per transaction by the background job. */
    @Min(1)
    @Max(100_000)
    private int batchSize = 500;

    /** Upper bound for any caller-supplied promotion limit. */
    @Min(1)
    @Max(100_000)
    private int maxBatchSize = 5000;

    /** Batches drained per shard in one scheduler run before moving on. */
    @Min(1)
    @Max(10_000)
    private int maxBatchesPerRun = 20;

    /** Instant that promoted positions are minted from. */
    @NotNull private PositionTimeSource positionTimeSource = PositionTimeSource.PROMOTION_INSTANT;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getFixedDelayMs() {
      return fixedDelayMs;
    }

    public void setFixedDelayMs(long fixedDelayMs) {
      this.fixedDelayMs = fixedDelayMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getMaxBatchSize() {
      return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
    }

    public int getMaxBatchesPerRun() {
      return maxBatchesPerRun;
    }

    public void setMaxBatchesPerRun(int maxBatchesPerRun) {
      this.maxBatchesPerRun = maxBatchesPerRun;
    }

    public PositionTimeSource getPositionTimeSource() {
      return positionTimeSource;
    }

    public void setPositionTimeSource(PositionTimeSource positionTimeSource) {
      this.positionTimeSource = positionTimeSource;
    }

    /** The background job's batch must itself be a valid promotion limit. */
    @AssertTrue(message = "batch-size must not exceed max-batch-size")
    public boolean isBatchSizeWithinMax() {
      return batchSize <= maxBatchSize;
    }
  }

  public static class Read {

    /** Page size used when a reader does not ask for one. */
    @Min(1)
    private int defaultPageSize = 100;

    @Min(1)
    @Max(100_000)
    private int maxPageSize = 1000;

    /** Whether caught-up readers also see staged rows that are not promoted yet. */
    private boolean outboxFallbackEnabled = true;

    /** How often a long-polling reader re-checks its shard. */
    @Min(1)
    @Max(60_000)
    private long longPollIntervalMs = 100;

    /** Longest wait a reader may ask for. */
    @Min(0)
    @Max(600_000)
    private long maxWaitMs = 30_000;

    public int getDefaultPageSize() {
      return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
      this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
      return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
      this.maxPageSize = maxPageSize;
    }

    public boolean isOutboxFallbackEnabled() {
      return outboxFallbackEnabled;
    }

    public void setOutboxFallbackEnabled(boolean outboxFallbackEnabled) {
      this.outboxFallbackEnabled = outboxFallbackEnabled;
    }

    public long getLongPollIntervalMs() {
      return longPollIntervalMs;
    }

    public void setLongPollIntervalMs(long longPollIntervalMs) {
      this.longPollIntervalMs = longPollIntervalMs;
    }

    public long getMaxWaitMs() {
      return maxWaitMs;
    }

    public void setMaxWaitMs(long maxWaitMs) {
      this.maxWaitMs = maxWaitMs;
    }

    @AssertTrue(message = "default-page-size must not exceed max-page-size")
    public boolean isDefaultPageSizeWithinMax() {
      return defaultPageSize <= maxPageSize;
    }
  }

  public static class Backfill {

    /** Largest number of items accepted by one backfill or staging batch. */
    @Min(1)
    @Max(100_000)
    private int maxBatchSize = 1000;

    public int getMaxBatchSize() {
      return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
    }
  }
}
