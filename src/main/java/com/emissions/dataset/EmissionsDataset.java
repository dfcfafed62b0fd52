package com.emissions.dataset;

import com.emissions.error.DatasetComputeException;
import com.emissions.model.EmissionRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Authoritative source of emission rows.
 */
public interface EmissionsDataset {

    /**
     * Rows dated within {@code [from, to]} (both inclusive) whose facility is in {@code facilities}.
     *
     * @throws DatasetComputeException if the source cannot be read
     */
    List<EmissionRecord> findRows(LocalDate from, LocalDate to, Set<String> facilities);

    /**
     * Number of rows held, or -1 when the source is unavailable.
     */
    int size();
}
