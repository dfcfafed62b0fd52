package com.emissions.aggregator;

import com.emissions.model.FacilityEmissions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running per-facility sums for a single aggregation pass.
 *
 * <p>Not thread-safe; one instance per pass. Kept apart from the immutable
 * {@link FacilityEmissions} so the mutable state never leaves the aggregator.
 */
class TotalsAccumulator {

    private final Map<String, Double> totals = new TreeMap<>();

    void add(FacilityEmissions row) {
        totals.merge(row.businessFacility(), row.totalEmissions(), Double::sum);
    }

    int size() {
        return totals.size();
    }

    /**
     * One row per facility, sorted by facility name.
     */
    List<FacilityEmissions> snapshot() {
        List<FacilityEmissions> rows = new ArrayList<>(totals.size());
        totals.forEach((facility, total) -> rows.add(new FacilityEmissions(facility, total)));
        return List.copyOf(rows);
    }
}
