package com.example.personioexport.interfaces.api.error;

import com.example.personioexport.application.exception.ApplicationException;
import com.example.personioexport.application.exception.ExportAlreadyRunningException;
import com.example.personioexport.domain.exception.DomainException;
import com.example.personioexport.infrastructure.exception.FileWriteException;
import com.example.personioexport.infrastructure.exception.InfrastructureException;
import com.example.personioexport.infrastructure.exception.PersonioApiException;
import com.example.personioexport.infrastructure.exception.PersonioAuthenticationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 * Fatal export failures are logged here at ERROR since this is the run boundary for HTTP triggered exports.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link PersonioAuthenticationException} to a 502 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(PersonioAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(PersonioAuthenticationException ex, HttpServletRequest request) {
        log.error("Export failed, authentication with Personio was rejected: {}", ex.getMessage());
        return buildResponse(ex, request, HttpStatus.BAD_GATEWAY, "AUTHENTICATION_ERROR", null);
    }

    /**
     * Maps {@link PersonioApiException} to a 502 response carrying the upstream status and endpoint.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(PersonioApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(PersonioApiException ex, HttpServletRequest request) {
        log.error("Export failed, Personio API call to {} failed: {}", ex.getEndpoint(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("upstreamStatus", ex.getStatus());
        details.put("endpoint", ex.getEndpoint());
        return buildResponse(ex, request, HttpStatus.BAD_GATEWAY, "API_ERROR", details);
    }

    /**
     * Maps {@link FileWriteException} to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(FileWriteException.class)
    public ResponseEntity<ErrorResponse> handleFileWrite(FileWriteException ex, HttpServletRequest request) {
        log.error("Export failed, output could not be written: {}", ex.getMessage());
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "FILE_WRITE_ERROR", null);
    }

    /**
     * Maps concurrent export triggers to a 409 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ExportAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyRunning(ExportAlreadyRunningException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.CONFLICT, "EXPORT_ALREADY_RUNNING", null);
    }

    /**
     * Maps generic domain exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR", null);
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR", null);
    }

    /**
     * Maps other infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Export failed: {}", ex.getMessage(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR", null);
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", null);
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @param details   optional machine readable details
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.of(status, errorCode, error.getMessage(), request.getRequestURI(), details);
        return ResponseEntity.status(status).body(response);
    }
}
