package com.emissions.store;

import com.emissions.error.StoreUnavailableException;

import java.util.List;
import java.util.Optional;

/**
 * String key/value store holding serialized cache entries.
 *
 * <p>Implementations must report infrastructure failures as {@link StoreUnavailableException}
 * and never as an absent value, so callers can tell "not cached" from "cache broken".
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * Store a value, replacing any previous one (last write wins).
     */
    void set(String key, String value);

    /**
     * All keys starting with {@code prefix}, each reported once. Order is unspecified.
     */
    List<String> scanKeys(String prefix);
}
