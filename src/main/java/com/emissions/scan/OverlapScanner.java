package com.emissions.scan;

import com.emissions.error.CorruptCacheEntryException;
import com.emissions.key.CacheKeyDeriver;
import com.emissions.model.CacheEntry;
import com.emissions.model.EmissionsQuery;
import com.emissions.model.FacilityEmissions;
import com.emissions.model.QueryContext;
import com.emissions.store.EmissionsCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Finds cached entries whose date range and facility set both intersect a query and
 * collects their rows, unaggregated.
 *
 * <p>Walks every key in the cache namespace, so cost is linear in the number of cached
 * entries and independent of dataset size. Keys are visited in sorted order to keep
 * the floating-point summation order, and therefore the result, stable.
 *
 * <p>An entry that fails to decode is logged and skipped. The query context is checked
 * before every entry; once it is cancelled or past its deadline the scan stops and
 * throws {@link com.emissions.error.QueryCancelledException}, discarding collected rows.
 *
 * <p>An entry whose range or facilities differ from the query still contributes all the
 * rows its policy selects, so the answer is an approximation. Each such reuse is logged
 * at INFO and counted in {@link #getPartialFragmentsReused()}.
 */
@Component
public class OverlapScanner {

    private static final Logger log = LoggerFactory.getLogger(OverlapScanner.class);

    private static final String STAGE = "overlap scan";

    private final EmissionsCacheStore cacheStore;
    private final String keyPrefix;
    private final OverlapPolicy policy;
    private final AtomicLong partialFragmentsReused = new AtomicLong();

    @Autowired
    public OverlapScanner(EmissionsCacheStore cacheStore,
                          CacheKeyDeriver keyDeriver,
                          @Value("${emissions.overlap.policy:include-all}") String policy) {
        this(cacheStore, keyDeriver.keyPrefix(), OverlapPolicy.fromLabel(policy)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported overlap policy: " + policy)));
    }

    public OverlapScanner(EmissionsCacheStore cacheStore, String keyPrefix, OverlapPolicy policy) {
        this.cacheStore = cacheStore;
        this.keyPrefix = keyPrefix;
        this.policy = policy;
    }

    public List<FacilityEmissions> findOverlapping(EmissionsQuery query, QueryContext context) {
        context.throwIfDone(STAGE);
        List<String> keys = cacheStore.scanKeys(keyPrefix).stream().sorted().toList();

        List<FacilityEmissions> rows = new ArrayList<>();
        int qualifying = 0;
        int partial = 0;
        int corrupt = 0;
        for (String key : keys) {
            context.throwIfDone(STAGE);

            Optional<CacheEntry> entry;
            try {
                entry = cacheStore.read(key);
            } catch (CorruptCacheEntryException e) {
                corrupt++;
                log.warn("Skipping corrupt cache entry: key={} reason={}", key, e.getMessage());
                continue;
            }
            if (entry.isEmpty() || !overlaps(entry.get(), query)) {
                continue;
            }

            CacheEntry hit = entry.get();
            qualifying++;
            rows.addAll(policy.select(hit, query));
            if (!hit.coversExactly(query)) {
                partial++;
                log.info("Approximate answer, reusing partial fragment: key={} cached={}..{} {} requested={}..{} {}",
                        key, hit.startDate(), hit.endDate(), hit.facilities(),
                        query.startDate(), query.endDate(), query.facilities());
            }
        }

        partialFragmentsReused.addAndGet(partial);
        log.info("Overlap scan: scanned={} qualifying={} partial={} corrupt={} rows={} policy={}",
                keys.size(), qualifying, partial, corrupt, rows.size(), policy.getLabel());
        return rows;
    }

    public OverlapPolicy getPolicy() {
        return policy;
    }

    /**
     * Fragments reused for a query they did not cover exactly, since startup.
     */
    public long getPartialFragmentsReused() {
        return partialFragmentsReused.get();
    }

    static boolean overlaps(CacheEntry entry, EmissionsQuery query) {
        return datesOverlap(entry.startDate(), entry.endDate(), query.startDate(), query.endDate())
                && facilitiesOverlap(entry.facilities(), query.facilities());
    }

    /**
     * Inclusive interval intersection. Commutative in its two ranges.
     */
    public static boolean datesOverlap(LocalDate start1, LocalDate end1, LocalDate start2, LocalDate end2) {
        return !(end1.isBefore(start2) || start1.isAfter(end2));
    }

    public static boolean facilitiesOverlap(Collection<String> first, Collection<String> second) {
        for (String facility : first) {
            if (second.contains(facility)) return true;
        }
        return false;
    }
}
