package org.budgetanalyzer.changefeed.domain;

/** Which instant promotion mints position tokens from. */
public enum PositionTimeSource {

  /** The clock at promotion time. */
  PROMOTION_INSTANT,

  /** The outbox row's time hint, never allowed to move the shard's feed backwards. */
  TIME_HINT
}
