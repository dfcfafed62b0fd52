package com.emissions.controller;

import com.emissions.error.EmissionsQueryException;
import com.emissions.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps query failures to HTTP statuses by {@link ErrorKind}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EmissionsQueryException.class)
    public ResponseEntity<ErrorResponse> handleQueryFailure(EmissionsQueryException e) {
        HttpStatus status = statusFor(e.kind());
        if (status.is5xxServerError()) {
            log.error("Emissions query failed: kind={} message={}", e.kind(), e.getMessage(), e);
        } else {
            log.warn("Emissions query rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.from(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorKind.VALIDATION.name(), "Request body must be a JSON object with "
                        + "startDate, endDate and businessFacility", false));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STORE_UNAVAILABLE, OVERLOADED -> HttpStatus.SERVICE_UNAVAILABLE;
            case CANCELLED -> HttpStatus.GATEWAY_TIMEOUT;
            case DATASET_COMPUTE, CORRUPT_CACHE_ENTRY -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
