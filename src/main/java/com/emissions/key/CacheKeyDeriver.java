package com.emissions.key;

import com.emissions.model.CacheKey;
import com.emissions.model.EmissionsQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the exact-match cache key for a query.
 *
 * <p>Canonical form: dates as {@code YYYY-MM-DD}, facilities sorted, fields ordered by name
 * ({@code businessFacility}, {@code endDate}, {@code startDate}), serialized as JSON and
 * hashed with SHA-256. The hex digest is prefixed with the namespace:
 * <pre>
 * emissions:15ae5ba2db556bdaa7eee95f1f56594deb909d1f5ffcf845a769b7c855cac062
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class CacheKeyDeriver {

    public static final String DEFAULT_NAMESPACE = "emissions";

    private static final String HASH_ALGORITHM = "SHA-256";

    private final String namespace;
    private final ObjectWriter canonicalWriter;

    public CacheKeyDeriver(@Value("${emissions.cache.namespace:" + DEFAULT_NAMESPACE + "}") String namespace) {
        if (namespace == null || namespace.isBlank() || namespace.indexOf(CacheKey.SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Cache namespace must be non-blank and contain no ':' : " + namespace);
        }
        this.namespace = namespace;
        this.canonicalWriter = new ObjectMapper()
                .writer(new CanonicalJsonPrinter())
                .with(new CanonicalJsonPrinter.AsciiOnlyEscapes());
    }

    public CacheKey deriveKey(EmissionsQuery query) {
        return CacheKey.of(namespace, sha256Hex(canonicalForm(query)));
    }

    /**
     * The exact string that is hashed.
     */
    public String canonicalForm(EmissionsQuery query) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("startDate", DateTimeFormatter.ISO_LOCAL_DATE.format(query.startDate()));
        fields.put("endDate", DateTimeFormatter.ISO_LOCAL_DATE.format(query.endDate()));
        fields.put("businessFacility", List.copyOf(query.facilities()));
        try {
            return canonicalWriter.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical query " + query, e);
        }
    }

    /**
     * Prefix every key of this namespace starts with, e.g. {@code emissions:}.
     */
    public String keyPrefix() {
        return namespace + CacheKey.SEPARATOR;
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }
}
