package com.emissions.store;

import com.emissions.error.CorruptCacheEntryException;
import com.emissions.model.CacheEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

/**
 * JSON wire encoding of {@link CacheEntry}.
 *
 * <p>Owns its mapper so the stored format does not drift with the web layer's Jackson settings.
 * Unknown fields are ignored; missing or malformed fields make the entry corrupt.
 */
@Component
public class CacheEntryCodec {

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .build();

    public String encode(CacheEntry entry) {
        try {
            return mapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode cache entry", e);
        }
    }

    /**
     * @param key  store key the value was read from, for error context
     * @param json raw stored value
     * @throws CorruptCacheEntryException if the value is not a complete cache entry
     */
    public CacheEntry decode(String key, String json) {
        try {
            CacheEntry entry = mapper.readValue(json, CacheEntry.class);
            if (entry == null) {
                throw new CorruptCacheEntryException(key, "Cache entry " + key + " is JSON null");
            }
            return entry;
        } catch (JsonProcessingException e) {
            throw new CorruptCacheEntryException(key, "Cache entry " + key + " is not valid: " + e.getOriginalMessage(), e);
        }
    }
}
