package com.emissions.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory, thread-safe key/value store for single-node runs and tests.
 *
 * <p>Backed by a {@link ConcurrentHashMap}; reads never block and a single key's
 * get/set is atomic, which is all the cache needs.
 */
@Repository
@ConditionalOnProperty(name = "emissions.cache.store", havingValue = "memory")
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final ConcurrentMap<String, String> store = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public void set(String key, String value) {
        store.put(key, value);
        log.debug("Stored value: key={} bytes={}", key, value.length());
    }

    @Override
    public List<String> scanKeys(String prefix) {
        return store.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .toList();
    }

    public int size() {
        return store.size();
    }

    /**
     * Clears all data, primarily for testing.
     */
    public void clear() {
        store.clear();
    }
}
