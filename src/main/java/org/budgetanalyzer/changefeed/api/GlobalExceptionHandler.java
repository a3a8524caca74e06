package org.budgetanalyzer.changefeed.api;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.budgetanalyzer.changefeed.exception.InvalidRequestException;
import org.budgetanalyzer.changefeed.service.ChangefeedServiceError;

/**
 * Maps exceptions to {@link ApiErrorResponse} bodies.
 *
 * <p>Invalid input becomes 400 with the {@link ChangefeedServiceError} code. Store failures that a
 * client can retry become 503 {@code STORE_UNAVAILABLE}; the failed batch or read has rolled back,
 * so retrying it is safe. Anything else becomes 500 {@code INTERNAL_ERROR}, except Spring's own
 * web exceptions, which keep the status they carry.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleInvalidRequest(InvalidRequestException e) {
    log.warn("Invalid request: {}", e.getMessage());
    return new ApiErrorResponse(
        ApiErrorResponse.INVALID_REQUEST, e.getMessage(), e.getError().name());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
    var message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Request validation failed: {}", message);
    return new ApiErrorResponse(
        ApiErrorResponse.INVALID_REQUEST, message, ChangefeedServiceError.VALIDATION_FAILED.name());
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleHandlerMethodValidation(HandlerMethodValidationException e) {
    var message =
        e.getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Request validation failed: {}", message);
    return new ApiErrorResponse(
        ApiErrorResponse.INVALID_REQUEST, message, ChangefeedServiceError.VALIDATION_FAILED.name());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleTypeMismatch(MethodArgumentTypeMismatchException e) {
    var message = "Invalid value for parameter '" + e.getName() + "': " + e.getValue();
    log.warn(message);
    return new ApiErrorResponse(
        ApiErrorResponse.INVALID_REQUEST, message, ChangefeedServiceError.VALIDATION_FAILED.name());
  }

  @ExceptionHandler({
    TransientDataAccessException.class,
    DataAccessResourceFailureException.class,
    CannotCreateTransactionException.class
  })
  @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
  public ApiErrorResponse handleStoreUnavailable(Exception e) {
    log.error("Store unavailable: {}", e.getMessage(), e);
    return new ApiErrorResponse(
        ApiErrorResponse.SERVICE_UNAVAILABLE,
        "The changefeed store is temporarily unavailable, retry the request",
        ChangefeedServiceError.STORE_UNAVAILABLE.name());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleMessageNotReadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable request body: {}", e.getMessage());
    return new ApiErrorResponse(
        ApiErrorResponse.INVALID_REQUEST,
        "Request body is missing or malformed",
        ChangefeedServiceError.VALIDATION_FAILED.name());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception e) {
    if (e instanceof ErrorResponse errorResponse) {
      var status = errorResponse.getStatusCode();
      log.warn("Request failed with {}: {}", status.value(), e.getMessage());
      var type =
          status.is4xxClientError()
              ? ApiErrorResponse.INVALID_REQUEST
              : ApiErrorResponse.INTERNAL_ERROR;
      return ResponseEntity.status(status)
          .body(new ApiErrorResponse(type, e.getMessage(), null));
    }

    log.error("Unexpected error: {}", e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiErrorResponse(
                ApiErrorResponse.INTERNAL_ERROR, "An unexpected error occurred", null));
  }
}
