package com.emissions.aggregator;

import com.emissions.model.FacilityEmissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Folds any number of result rows into exactly one row per facility.
 *
 * <p>Used for both sources of rows: fragments recombined from overlapping cache entries
 * and rows selected from the dataset. Output is sorted by facility name, so the same
 * input always yields the same sequence.
 */
@Component
public class EmissionsAggregator {

    private static final Logger log = LoggerFactory.getLogger(EmissionsAggregator.class);

    public List<FacilityEmissions> aggregate(Collection<FacilityEmissions> rows) {
        TotalsAccumulator accumulator = new TotalsAccumulator();
        for (FacilityEmissions row : rows) {
            accumulator.add(row);
        }
        log.debug("Aggregated {} rows into {} facility totals", rows.size(), accumulator.size());
        return accumulator.snapshot();
    }
}
