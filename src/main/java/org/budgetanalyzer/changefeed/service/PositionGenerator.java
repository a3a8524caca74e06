package org.budgetanalyzer.changefeed.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Component;

import org.budgetanalyzer.changefeed.domain.PositionToken;

/**
 * Mints time-prefixed {@link PositionToken}s.
 *
 * <p>Tokens minted from later instants sort later. Tokens minted within the same millisecond are
 * ordered by their random suffix only, which callers that need strict succession avoid by using
 * {@link #mintAfter(Instant, PositionToken)}.
 */
@Component
public class PositionGenerator {

  private static final int SUFFIX_LENGTH = PositionToken.LENGTH - PositionToken.TIMESTAMP_LENGTH;

  private final SecureRandom random = new SecureRandom();
  private final Clock clock;

  public PositionGenerator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Mints a token for the given instant with a random suffix.
   *
   * @param instant the minting instant
   * @return a new token
   * @throws IllegalArgumentException if the instant is before the epoch or beyond the 48-bit range
   */
  public PositionToken mint(Instant instant) {
    var suffix = new byte[SUFFIX_LENGTH];
    random.nextBytes(suffix);
    return PositionToken.of(instant.toEpochMilli(), suffix);
  }

  /**
   * Mints a token strictly greater than {@code previous}.
   *
   * <p>When {@code instant} falls in or before the millisecond of {@code previous}, the previous
   * token is incremented instead, so its timestamp carries over. A null or zero {@code previous}
   * behaves like {@link #mint(Instant)}.
   *
   * @param instant the minting instant
   * @param previous the token the result must follow, may be null
   * @return a token sorting after {@code previous}
   */
  public PositionToken mintAfter(Instant instant, PositionToken previous) {
    if (previous == null || previous.isZero()) {
      return mint(instant);
    }
    if (instant.toEpochMilli() <= previous.timestampMillis()) {
      return previous.increment();
    }
    return mint(instant);
  }

  /** Mints a token for the current instant of the configured clock. */
  public PositionToken mintNow() {
    return mint(clock.instant());
  }

  public Instant now() {
    return clock.instant();
  }
}
