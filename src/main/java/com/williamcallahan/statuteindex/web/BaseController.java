package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.domain.errors.ApiErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Base controller class providing common error handling patterns.
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Maps invalid input (unknown format, unknown status filter, missing citation) to 400.
     *
     * @param validationException The validation exception
     * @return Bad request error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    /**
     * Maps a malformed request body to 400.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException unreadable) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    /**
     * Maps anything unexpected to 500 after logging it.
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpectedException(RuntimeException unexpected) {
        log.error("Unhandled request failure: {}", unexpected.getMessage(), unexpected);
        return handleServiceException(unexpected, "process request");
    }

    /**
     * Handles service exceptions with standardized error responses.
     *
     * @param exception The exception that occurred
     * @param operation Description of the operation that failed
     * @return Standardized error response
     */
    protected ResponseEntity<ApiErrorResponse> handleServiceException(Exception exception, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation, exception);
    }

    /**
     * Builds a 404 response naming what could not be found.
     */
    protected ResponseEntity<ApiErrorResponse> notFound(String message) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, message);
    }
}
