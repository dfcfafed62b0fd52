package com.emissions.error;

/**
 * A stored cache value that does not decode into a valid entry.
 */
public class CorruptCacheEntryException extends EmissionsQueryException {

    private final String key;

    public CorruptCacheEntryException(String key, String message) {
        super(ErrorKind.CORRUPT_CACHE_ENTRY, message);
        this.key = key;
    }

    public CorruptCacheEntryException(String key, String message, Throwable cause) {
        super(ErrorKind.CORRUPT_CACHE_ENTRY, message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
