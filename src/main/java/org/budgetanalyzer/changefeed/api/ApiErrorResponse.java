package org.budgetanalyzer.changefeed.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error returned by every endpoint of the service")
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            allowableValues = {"INVALID_REQUEST", "SERVICE_UNAVAILABLE", "INTERNAL_ERROR"},
            example = "INVALID_REQUEST")
        String type,
    @Schema(
            description = "Human readable description",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Page size must be between 1 and 1000, got 0")
        String message,
    @Schema(
            description = "Machine readable error code",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "INVALID_PAGE_SIZE")
        String code) {

  public static final String INVALID_REQUEST = "INVALID_REQUEST";
  public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
