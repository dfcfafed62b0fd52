package com.emissions.service;

import com.emissions.model.CacheKey;
import com.emissions.model.FacilityEmissions;

import java.util.List;

/**
 * Final result of one query.
 *
 * @param results  one row per facility, sorted by facility
 * @param source   which path produced the rows
 * @param cacheKey exact-match key the rows are cached under
 */
public record QueryOutcome(List<FacilityEmissions> results, ResolutionSource source, CacheKey cacheKey) {

    public QueryOutcome {
        results = List.copyOf(results);
    }
}
