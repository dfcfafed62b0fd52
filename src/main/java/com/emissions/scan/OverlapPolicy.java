package com.emissions.scan;

import com.emissions.model.CacheEntry;
import com.emissions.model.EmissionsQuery;
import com.emissions.model.FacilityEmissions;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Which rows of a qualifying cached entry are reused for a new query.
 *
 * <p>Neither policy clips by date: an entry whose range only partly overlaps the query
 * contributes its full-range totals, so recombined answers are approximate unless the
 * ranges line up.
 */
public enum OverlapPolicy {

    /** Overlap is a trigger, not a filter: every row of the entry is used. */
    INCLUDE_ALL("include-all") {
        @Override
        List<FacilityEmissions> select(CacheEntry entry, EmissionsQuery query) {
            return entry.results();
        }
    },

    /** Only rows for facilities the query asked for are used. */
    CLIP_FACILITIES("clip-facilities") {
        @Override
        List<FacilityEmissions> select(CacheEntry entry, EmissionsQuery query) {
            return entry.results().stream()
                    .filter(row -> query.facilities().contains(row.businessFacility()))
                    .toList();
        }
    };

    private static final Map<String, OverlapPolicy> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(OverlapPolicy::getLabel, Function.identity()));

    private final String label;

    OverlapPolicy(String label) {
        this.label = label;
    }

    abstract List<FacilityEmissions> select(CacheEntry entry, EmissionsQuery query);

    public String getLabel() {
        return label;
    }

    public static Optional<OverlapPolicy> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }
}
