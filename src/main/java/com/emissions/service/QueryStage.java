package com.emissions.service;

/**
 * States of a query resolution: {@code EXACT_LOOKUP -> OVERLAP_SCAN -> FALLBACK -> PERSIST -> DONE}.
 * An exact hit goes straight to {@code DONE}; an overlap hit skips {@code FALLBACK}.
 */
public enum QueryStage {
    EXACT_LOOKUP,
    OVERLAP_SCAN,
    FALLBACK,
    PERSIST,
    DONE
}
