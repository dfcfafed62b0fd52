package com.emissions.error;

public class StoreUnavailableException extends EmissionsQueryException {

    public StoreUnavailableException(String message) {
        super(ErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
