package com.emissions.model;

import java.time.LocalDate;

/**
 * One authoritative dataset row.
 *
 * @param transactionDate  date the emission was recorded
 * @param businessFacility facility the row belongs to
 * @param co2Item          emitted CO2 for the row
 */
public record EmissionRecord(LocalDate transactionDate, String businessFacility, double co2Item) {

    public EmissionRecord {
        if (transactionDate == null) throw new IllegalArgumentException("transactionDate must not be null");
        if (businessFacility == null) throw new IllegalArgumentException("businessFacility must not be null");
    }

    public FacilityEmissions toResultRow() {
        return new FacilityEmissions(businessFacility, co2Item);
    }
}
