package com.emissions.store;

import com.emissions.error.CorruptCacheEntryException;
import com.emissions.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed key/value store.
 *
 * <p>Keys are enumerated with incremental {@code SCAN MATCH prefix*} so a large cache
 * does not block the server the way {@code KEYS} would. SCAN may return a key more than
 * once, hence the de-duplication.
 *
 * <p>A GET answered with {@code WRONGTYPE} means some other client stored a hash, list or
 * set under one of our keys. That key is reported as a corrupt entry; any other Redis
 * failure means the store is unavailable.
 */
@Repository
@ConditionalOnProperty(name = "emissions.cache.store", havingValue = "redis", matchIfMissing = true)
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private static final String WRONGTYPE_REPLY = "WRONGTYPE";

    private final StringRedisTemplate redisTemplate;
    private final long scanBatchSize;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate,
                              @Value("${emissions.cache.scan-batch-size:500}") long scanBatchSize) {
        this.redisTemplate = redisTemplate;
        this.scanBatchSize = scanBatchSize;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            if (isWrongType(e)) {
                throw new CorruptCacheEntryException(key, "Key " + key + " does not hold a string value", e);
            }
            throw new StoreUnavailableException("Redis GET failed for key " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        try {
            redisTemplate.opsForValue().set(key, value);
            log.debug("Redis SET key={} bytes={}", key, value.length());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis SET failed for key " + key, e);
        }
    }

    @Override
    public List<String> scanKeys(String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(scanBatchSize)
                .build();
        Set<String> keys = new LinkedHashSet<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis SCAN failed for prefix " + prefix, e);
        }
        log.debug("Redis SCAN prefix={} found {} keys", prefix, keys.size());
        return List.copyOf(keys);
    }

    private static boolean isWrongType(DataAccessException e) {
        if (!(e instanceof RedisSystemException || e instanceof InvalidDataAccessApiUsageException)) {
            return false;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(WRONGTYPE_REPLY)) {
                return true;
            }
        }
        return false;
    }
}
