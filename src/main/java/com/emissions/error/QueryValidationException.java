package com.emissions.error;

/**
 * Rejected inbound query. Raised before any store access.
 */
public class QueryValidationException extends EmissionsQueryException {

    public QueryValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public QueryValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
