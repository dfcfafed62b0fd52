package com.emissions.error;

/**
 * Failure classes a query can end in. Callers discriminate on the kind rather than
 * on the exception type.
 */
public enum ErrorKind {

    /** Malformed or missing request fields. Never cached. */
    VALIDATION(false),

    /** Cache store unreachable or too slow. */
    STORE_UNAVAILABLE(true),

    /** A stored entry could not be decoded. Recovered locally by skipping it. */
    CORRUPT_CACHE_ENTRY(false),

    /** The authoritative dataset could not produce an answer. */
    DATASET_COMPUTE(true),

    /** The request deadline elapsed or the request was cancelled. */
    CANCELLED(true),

    /** The worker pool had no room for another store or dataset call. */
    OVERLOADED(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
