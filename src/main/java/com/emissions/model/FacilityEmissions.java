package com.emissions.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Total emissions for one business facility. Also the wire shape of a cached result row.
 *
 * @param businessFacility facility name
 * @param totalEmissions   summed CO2 value
 */
public record FacilityEmissions(
        @JsonProperty("businessFacility") String businessFacility,
        @JsonProperty("totalEmissions") double totalEmissions
) {

    public FacilityEmissions {
        if (businessFacility == null) throw new IllegalArgumentException("businessFacility must not be null");
    }
}
