package com.fintech.scanner.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every API endpoint.
 *
 * @param parameterErrors Present only when request parameters were rejected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error returned when a request cannot be served")
public record ErrorResponse(
    @Schema(example = "400") int status,
    @Schema(description = "Machine-readable error code", example = "TYPE_MISMATCH") String error,
    @Schema(example = "Parameter 'lastUpdate' must be a valid long") String message,
    @Schema(example = "/api/updates") String path,
    Instant timestamp,
    List<ParameterError> parameterErrors
) {

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(), null);
    }

    public static ErrorResponse rejected(HttpStatus status, String error, String message, String path,
                                         List<ParameterError> parameterErrors) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(), List.copyOf(parameterErrors));
    }

    /** One rejected query parameter. */
    @Schema(description = "Rejected request parameter")
    public record ParameterError(
        @Schema(example = "lastUpdate") String parameter,
        @Schema(example = "-1") String rejectedValue,
        @Schema(example = "lastUpdate cannot be negative") String reason
    ) {
    }
}
