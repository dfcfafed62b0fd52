package com.emissions.controller;

import com.emissions.model.EmissionsQuery;

import java.util.List;

/**
 * Inbound request body.
 *
 * <pre>
 * {
 *   "startDate": "2023-01-01",
 *   "endDate": "2023-06-30",
 *   "businessFacility": ["GreenEat Changi", "GreenEat Orchard"]
 * }
 * </pre>
 */
public record EmissionsRequest(String startDate, String endDate, List<String> businessFacility) {

    /**
     * @throws com.emissions.error.QueryValidationException if the fields do not form a valid query
     */
    public EmissionsQuery toQuery() {
        return EmissionsQuery.parse(startDate, endDate, businessFacility);
    }
}
