package com.emissions.controller;

import com.emissions.error.EmissionsQueryException;

/**
 * Error body returned for every failed query.
 */
public record ErrorResponse(String kind, String message, boolean retryable) {

    public static ErrorResponse from(EmissionsQueryException e) {
        return new ErrorResponse(e.kind().name(), e.getMessage(), e.kind().isRetryable());
    }
}
