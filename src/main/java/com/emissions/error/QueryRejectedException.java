package com.emissions.error;

/**
 * The query could not be started because the worker pool is saturated.
 */
public class QueryRejectedException extends EmissionsQueryException {

    public QueryRejectedException(String message) {
        super(ErrorKind.OVERLOADED, message);
    }

    public QueryRejectedException(String message, Throwable cause) {
        super(ErrorKind.OVERLOADED, message, cause);
    }
}
