package com.emissions.service;

/**
 * Where a query's answer came from.
 */
public enum ResolutionSource {

    /** Cached under the query's own key; returned as stored. */
    EXACT,

    /** Recombined from overlapping cached entries. */
    OVERLAP,

    /** Computed from the dataset. */
    DATASET
}
