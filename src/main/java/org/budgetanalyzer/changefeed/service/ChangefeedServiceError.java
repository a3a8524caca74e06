package org.budgetanalyzer.changefeed.service;

/** Error codes reported in {@code ApiErrorResponse.code}. */
public enum ChangefeedServiceError {
  /** Cursor is not a 16-byte position token. */
  INVALID_CURSOR,

  /** Requested page size is outside the configured bounds. */
  INVALID_PAGE_SIZE,

  /** Promotion limit or batch length is below one or above the configured maximum. */
  INVALID_BATCH_SIZE,

  /** Backfill instant lies in the future or outside the position token range. */
  INVALID_BACKFILL_INSTANT,

  /** Long-poll wait is negative or longer than the configured maximum. */
  INVALID_WAIT,

  /** Request failed bean validation. */
  VALIDATION_FAILED,

  /** The underlying store is unavailable; the request can be retried. */
  STORE_UNAVAILABLE,
}
