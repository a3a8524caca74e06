package org.budgetanalyzer.changefeed.domain;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.UUID;

import org.budgetanalyzer.changefeed.exception.InvalidCursorException;

/**
 * A 16-byte, time-prefixed position in a shard's feed.
 *
 * <p>Layout: bytes 0-5 hold the big-endian epoch millisecond at which the token was minted, bytes
 * 6-15 hold 80 bits of randomness. Tokens are ordered by unsigned byte-wise comparison, which is
 * also how PostgreSQL orders {@code bytea}, so the database and this class always agree on feed
 * order.
 *
 * <p>The all-zero token sorts before every minted token and is the cursor for "from the
 * beginning".
 */
public final class PositionToken implements Comparable<PositionToken> {

  /** Token length in bytes. */
  public static final int LENGTH = 16;

  /** Length of the millisecond timestamp prefix in bytes. */
  public static final int TIMESTAMP_LENGTH = 6;

  /** Largest epoch millisecond that fits in the 48-bit prefix. */
  public static final long MAX_TIMESTAMP_MILLIS = (1L << 48) - 1;

  private static final HexFormat HEX = HexFormat.of();

  private static final PositionToken ZERO = new PositionToken(new byte[LENGTH]);

  private final byte[] bytes;

  private PositionToken(byte[] bytes) {
    this.bytes = bytes;
  }

  /** Returns the all-zero token, i.e. the cursor for the start of a feed. */
  public static PositionToken zero() {
    return ZERO;
  }

  /**
   * Wraps raw token bytes.
   *
   * @param bytes exactly 16 bytes; copied
   * @return the token
   * @throws InvalidCursorException if {@code bytes} is null or not 16 bytes long
   */
  public static PositionToken fromBytes(byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new InvalidCursorException(
          "Position token must be exactly "
              + LENGTH
              + " bytes, got "
              + (bytes == null ? "null" : bytes.length));
    }
    return new PositionToken(bytes.clone());
  }

  /**
   * Parses the 32 character hex form produced by {@link #toHex()}.
   *
   * <p>A null or blank value is the zero token, so a consumer without a stored cursor reads from
   * the beginning.
   *
   * @param hex hex encoded token, case-insensitive
   * @return the token
   * @throws InvalidCursorException if the value is not 32 hex characters
   */
  public static PositionToken fromHex(String hex) {
    if (hex == null || hex.isBlank()) {
      return ZERO;
    }
    var trimmed = hex.trim();
    if (trimmed.length() != LENGTH * 2) {
      throw new InvalidCursorException(
          "Cursor must be " + (LENGTH * 2) + " hex characters, got " + trimmed.length());
    }
    try {
      return new PositionToken(HEX.parseHex(trimmed));
    } catch (IllegalArgumentException e) {
      throw new InvalidCursorException("Cursor is not valid hex: " + trimmed, e);
    }
  }

  /**
   * Builds a token from a timestamp and an explicit 10-byte suffix.
   *
   * @param epochMillis timestamp prefix, must fit in 48 bits
   * @param suffix exactly 10 bytes
   * @return the token
   */
  public static PositionToken of(long epochMillis, byte[] suffix) {
    checkTimestamp(epochMillis);
    if (suffix.length != LENGTH - TIMESTAMP_LENGTH) {
      throw new IllegalArgumentException(
          "Suffix must be " + (LENGTH - TIMESTAMP_LENGTH) + " bytes, got " + suffix.length);
    }
    var bytes = new byte[LENGTH];
    writeTimestamp(bytes, epochMillis);
    System.arraycopy(suffix, 0, bytes, TIMESTAMP_LENGTH, suffix.length);
    return new PositionToken(bytes);
  }

  /**
   * Derives a stable, non-persisted token for an outbox entry that has not been promoted yet.
   *
   * <p>The same outbox entry always yields the same token, so repeated reads present it with the
   * same identity. The token must not be used as a cursor.
   *
   * @param timeHint the entry's time hint
   * @param aggregateId the entry's aggregate id
   * @param sequence the entry's sequence number
   * @return a presentation token ordered by the time hint
   */
  public static PositionToken provisional(Instant timeHint, UUID aggregateId, long sequence) {
    var millis = clamp(timeHint).toEpochMilli();
    var buffer = ByteBuffer.allocate(LENGTH);
    buffer.putShort((short) (millis >>> 32));
    buffer.putInt((int) millis);
    buffer.putShort((short) (aggregateId.getMostSignificantBits() >>> 48));
    buffer.putLong(aggregateId.getLeastSignificantBits() ^ sequence);
    return new PositionToken(buffer.array());
  }

  /**
   * Returns whether an instant can be stored in the 48-bit timestamp prefix, i.e. lies between the
   * epoch and roughly the year 10889.
   */
  public static boolean isRepresentable(Instant instant) {
    return !instant.isBefore(Instant.EPOCH)
        && !instant.isAfter(Instant.ofEpochMilli(MAX_TIMESTAMP_MILLIS));
  }

  /**
   * Moves an instant into the range a position token can carry: instants before the epoch become
   * the epoch, instants past the 48-bit limit become the limit.
   *
   * @param instant any instant
   * @return the nearest representable instant
   */
  public static Instant clamp(Instant instant) {
    if (instant.isBefore(Instant.EPOCH)) {
      return Instant.EPOCH;
    }
    var max = Instant.ofEpochMilli(MAX_TIMESTAMP_MILLIS);
    return instant.isAfter(max) ? max : instant;
  }

  private static void checkTimestamp(long epochMillis) {
    if (epochMillis < 0 || epochMillis > MAX_TIMESTAMP_MILLIS) {
      throw new IllegalArgumentException(
          "Timestamp " + epochMillis + " ms is outside the 48-bit position token range");
    }
  }

  private static void writeTimestamp(byte[] bytes, long epochMillis) {
    for (int i = TIMESTAMP_LENGTH - 1; i >= 0; i--) {
      bytes[i] = (byte) epochMillis;
      epochMillis >>>= 8;
    }
  }

  /** Returns the epoch millisecond stored in the 6-byte prefix. */
  public long timestampMillis() {
    long millis = 0;
    for (int i = 0; i < TIMESTAMP_LENGTH; i++) {
      millis = (millis << 8) | (bytes[i] & 0xFF);
    }
    return millis;
  }

  /** Returns the minting instant stored in the prefix, truncated to milliseconds. */
  public Instant timestamp() {
    return Instant.ofEpochMilli(timestampMillis());
  }

  /**
   * Returns the next token in byte order: the 80-bit suffix plus one.
   *
   * <p>When the suffix is already all ones the carry moves into the timestamp, so the result still
   * sorts strictly after this token.
   */
  public PositionToken increment() {
    var next = bytes.clone();
    for (int i = LENGTH - 1; i >= 0; i--) {
      next[i]++;
      if (next[i] != 0) {
        return new PositionToken(next);
      }
    }
    throw new IllegalStateException("Position token space exhausted");
  }

  public boolean isZero() {
    return equals(ZERO);
  }

  /** Returns a copy of the raw 16 bytes. */
  public byte[] toBytes() {
    return bytes.clone();
  }

  /** Returns the 32 character lowercase hex form used as the HTTP cursor. */
  public String toHex() {
    return HEX.formatHex(bytes);
  }

  @Override
  public int compareTo(PositionToken other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PositionToken that)) return false;
    return Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
