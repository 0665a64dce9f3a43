package com.example.personioexport.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned when an export trigger fails.
 *
 * @param timestamp when the failure was mapped
 * @param status    HTTP status code
 * @param error     stable error code, e.g. {@code API_ERROR}
 * @param message   failure message of the run
 * @param path      request path
 * @param details   upstream status and endpoint for Personio API failures, omitted otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {

    public static ErrorResponse of(HttpStatus status, String errorCode, String message, String path,
                                   Map<String, Object> details) {
        return new ErrorResponse(Instant.now(), status.value(), errorCode, message, path, details);
    }
}
