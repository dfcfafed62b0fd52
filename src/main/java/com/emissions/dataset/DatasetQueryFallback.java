package com.emissions.dataset;

import com.emissions.aggregator.EmissionsAggregator;
import com.emissions.error.DatasetComputeException;
import com.emissions.error.EmissionsQueryException;
import com.emissions.model.EmissionRecord;
import com.emissions.model.EmissionsQuery;
import com.emissions.model.FacilityEmissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ground-truth computation straight from the dataset, used when no cached fragment helps.
 */
@Service
public class DatasetQueryFallback {

    private static final Logger log = LoggerFactory.getLogger(DatasetQueryFallback.class);

    private final EmissionsDataset dataset;
    private final EmissionsAggregator aggregator;

    public DatasetQueryFallback(EmissionsDataset dataset, EmissionsAggregator aggregator) {
        this.dataset = dataset;
        this.aggregator = aggregator;
    }

    public List<FacilityEmissions> computeFromSource(EmissionsQuery query) {
        List<EmissionRecord> rows;
        try {
            rows = dataset.findRows(query.startDate(), query.endDate(), query.facilities());
        } catch (EmissionsQueryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DatasetComputeException("Dataset lookup failed for " + query, e);
        }
        log.debug("Dataset selected {} rows for range={}..{} facilities={}",
                rows.size(), query.startDate(), query.endDate(), query.facilities());
        return aggregator.aggregate(rows.stream().map(EmissionRecord::toResultRow).toList());
    }
}
