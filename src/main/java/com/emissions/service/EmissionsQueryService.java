package com.emissions.service;

import com.emissions.aggregator.EmissionsAggregator;
import com.emissions.dataset.DatasetQueryFallback;
import com.emissions.error.CorruptCacheEntryException;
import com.emissions.key.CacheKeyDeriver;
import com.emissions.model.CacheEntry;
import com.emissions.model.CacheKey;
import com.emissions.model.EmissionsQuery;
import com.emissions.model.FacilityEmissions;
import com.emissions.model.QueryContext;
import com.emissions.scan.OverlapScanner;
import com.emissions.store.EmissionsCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Resolves an emissions query against the cache, falling back to the dataset.
 *
 * <ol>
 *   <li>{@link QueryStage#EXACT_LOOKUP}: a hit under the query's own key is returned as stored.</li>
 *   <li>{@link QueryStage#OVERLAP_SCAN}: rows of all overlapping entries are aggregated.</li>
 *   <li>{@link QueryStage#FALLBACK}: only when no entry overlaps, the dataset is aggregated.</li>
 *   <li>{@link QueryStage#PERSIST}: the answer is written under the exact key.</li>
 * </ol>
 *
 * <p>Stateless between requests. Two identical concurrent queries may both miss and both
 * write; the writes are identical so the last one winning is harmless. Store failures
 * propagate and never degrade into a dataset computation. No step is retried.
 */
@Service
public class EmissionsQueryService {

    private static final Logger log = LoggerFactory.getLogger(EmissionsQueryService.class);

    private final CacheKeyDeriver keyDeriver;
    private final EmissionsCacheStore cacheStore;
    private final OverlapScanner overlapScanner;
    private final EmissionsAggregator aggregator;
    private final DatasetQueryFallback datasetFallback;
    private final BoundedCalls boundedCalls;
    private final Duration defaultTimeout;

    public EmissionsQueryService(CacheKeyDeriver keyDeriver,
                                 EmissionsCacheStore cacheStore,
                                 OverlapScanner overlapScanner,
                                 EmissionsAggregator aggregator,
                                 DatasetQueryFallback datasetFallback,
                                 BoundedCalls boundedCalls,
                                 @Value("${emissions.query.timeout-ms:5000}") long timeoutMs) {
        this.keyDeriver = keyDeriver;
        this.cacheStore = cacheStore;
        this.overlapScanner = overlapScanner;
        this.aggregator = aggregator;
        this.datasetFallback = datasetFallback;
        this.boundedCalls = boundedCalls;
        this.defaultTimeout = Duration.ofMillis(timeoutMs);
    }

    /**
     * Resolve with the configured default deadline.
     */
    public QueryOutcome query(EmissionsQuery query) {
        return query(query, QueryContext.withTimeout(defaultTimeout));
    }

    public QueryOutcome query(EmissionsQuery query, QueryContext context) {
        CacheKey key = keyDeriver.deriveKey(query);
        log.info("Emissions query: key={} range={}..{} facilities={}",
                key, query.startDate(), query.endDate(), query.facilities());

        QueryStage stage = QueryStage.EXACT_LOOKUP;
        List<FacilityEmissions> results = List.of();
        ResolutionSource source = null;

        while (stage != QueryStage.DONE) {
            log.debug("[{}] stage={}", key, stage);
            switch (stage) {
                case EXACT_LOOKUP -> {
                    Optional<CacheEntry> hit = boundedCalls.call("exact lookup", context, () -> lookupExact(key));
                    if (hit.isPresent()) {
                        results = hit.get().results();
                        source = ResolutionSource.EXACT;
                        stage = QueryStage.DONE;
                    } else {
                        stage = QueryStage.OVERLAP_SCAN;
                    }
                }
                case OVERLAP_SCAN -> {
                    List<FacilityEmissions> fragments = boundedCalls.call("overlap scan", context,
                            () -> overlapScanner.findOverlapping(query, context));
                    if (fragments.isEmpty()) {
                        stage = QueryStage.FALLBACK;
                    } else {
                        results = aggregator.aggregate(fragments);
                        source = ResolutionSource.OVERLAP;
                        stage = QueryStage.PERSIST;
                    }
                }
                case FALLBACK -> {
                    results = boundedCalls.call("dataset fallback", context,
                            () -> datasetFallback.computeFromSource(query));
                    source = ResolutionSource.DATASET;
                    stage = QueryStage.PERSIST;
                }
                case PERSIST -> {
                    CacheEntry entry = CacheEntry.of(query, results);
                    boundedCalls.run("persist", context, () -> cacheStore.set(key, entry));
                    stage = QueryStage.DONE;
                }
                default -> throw new IllegalStateException("Unexpected stage " + stage);
            }
        }

        log.info("Emissions query resolved: key={} source={} rows={}", key, source, results.size());
        return new QueryOutcome(results, source, key);
    }

    /**
     * A corrupt value under the exact key counts as a miss; the persist step overwrites it.
     */
    private Optional<CacheEntry> lookupExact(CacheKey key) {
        try {
            return cacheStore.get(key);
        } catch (CorruptCacheEntryException e) {
            log.warn("Corrupt entry under exact key {}, recomputing: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public String cacheKeyPrefix() {
        return keyDeriver.keyPrefix();
    }
}
