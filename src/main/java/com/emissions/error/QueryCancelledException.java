package com.emissions.error;

public class QueryCancelledException extends EmissionsQueryException {

    public QueryCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }

    public QueryCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
