package org.budgetanalyzer.changefeed.exception;

import org.budgetanalyzer.changefeed.service.ChangefeedServiceError;

/**
 * Thrown when a caller passes arguments that can never succeed, such as an out-of-range page size
 * or a backfill instant in the future. Not retryable.
 */
public class InvalidRequestException extends RuntimeException {

  private final ChangefeedServiceError error;

  public InvalidRequestException(String message, ChangefeedServiceError error) {
    super(message);
    this.error = error;
  }

  public ChangefeedServiceError getError() {
    return error;
  }
}
