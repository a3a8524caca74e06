package org.budgetanalyzer.changefeed.exception;

import org.budgetanalyzer.changefeed.service.ChangefeedServiceError;

/** Thrown when a cursor cannot be decoded into a 16-byte position token. */
public class InvalidCursorException extends InvalidRequestException {

  public InvalidCursorException(String message) {
    super(message, ChangefeedServiceError.INVALID_CURSOR);
  }

  public InvalidCursorException(String message, Throwable cause) {
    this(message);
    initCause(cause);
  }
}
