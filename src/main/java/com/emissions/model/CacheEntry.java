package com.emissions.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.List;

/**
 * A cached query result together with the range and facilities it was computed for.
 *
 * <pre>
 * {
 *   "start_date": "2023-01-01",
 *   "end_date": "2023-01-31",
 *   "facilities": ["GreenEat Changi"],
 *   "results": [{"businessFacility": "GreenEat Changi", "totalEmissions": 10.0}]
 * }
 * </pre>
 */
@JsonPropertyOrder({"start_date", "end_date", "facilities", "results"})
public record CacheEntry(
        @JsonProperty("start_date") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate startDate,
        @JsonProperty("end_date") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate endDate,
        @JsonProperty("facilities") List<String> facilities,
        @JsonProperty("results") List<FacilityEmissions> results
) {

    public CacheEntry {
        if (startDate == null) throw new IllegalArgumentException("start_date is required");
        if (endDate == null) throw new IllegalArgumentException("end_date is required");
        if (facilities == null) throw new IllegalArgumentException("facilities is required");
        if (results == null) throw new IllegalArgumentException("results is required");
        facilities = List.copyOf(facilities);
        results = List.copyOf(results);
    }

    /**
     * Entry for a freshly resolved query. Facilities are stored sorted.
     */
    public static CacheEntry of(EmissionsQuery query, List<FacilityEmissions> results) {
        return new CacheEntry(query.startDate(), query.endDate(), List.copyOf(query.facilities()), results);
    }

    public boolean coversExactly(EmissionsQuery query) {
        return startDate.equals(query.startDate()) && endDate.equals(query.endDate());
    }
}
