package com.emissions.store;

import com.emissions.error.CorruptCacheEntryException;
import com.emissions.model.CacheEntry;
import com.emissions.model.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Typed view over the {@link KeyValueStore}: entries go in and come out as {@link CacheEntry}.
 *
 * <p>Writes overwrite; merging happens in the aggregator before anything is written.
 * Reads never mutate the store.
 */
@Repository
public class EmissionsCacheStore {

    private static final Logger log = LoggerFactory.getLogger(EmissionsCacheStore.class);

    private final KeyValueStore store;
    private final CacheEntryCodec codec;

    public EmissionsCacheStore(KeyValueStore store, CacheEntryCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    /**
     * Exact-key lookup.
     *
     * @throws CorruptCacheEntryException if a value exists but does not decode
     */
    public Optional<CacheEntry> get(CacheKey key) {
        return read(key.value());
    }

    public void set(CacheKey key, CacheEntry entry) {
        store.set(key.value(), codec.encode(entry));
        log.debug("Cached entry: key={} range={}..{} facilities={} rows={}",
                key, entry.startDate(), entry.endDate(), entry.facilities().size(), entry.results().size());
    }

    /**
     * Keys of all entries under the given prefix.
     */
    public List<String> scanKeys(String prefix) {
        return store.scanKeys(prefix);
    }

    /**
     * Read one scanned key. Empty if the key vanished since it was scanned.
     *
     * @throws CorruptCacheEntryException if a value exists but does not decode
     */
    public Optional<CacheEntry> read(String key) {
        return store.get(key).map(json -> codec.decode(key, json));
    }

    public int countEntries(String prefix) {
        return store.scanKeys(prefix).size();
    }
}
