package com.emissions.error;

/**
 * Base type for every failure the query pipeline surfaces.
 */
public abstract class EmissionsQueryException extends RuntimeException {

    private final ErrorKind kind;

    protected EmissionsQueryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected EmissionsQueryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
