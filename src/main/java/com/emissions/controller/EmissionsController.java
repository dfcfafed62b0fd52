package com.emissions.controller;

import com.emissions.model.EmissionsQuery;
import com.emissions.model.FacilityEmissions;
import com.emissions.service.EmissionsQueryService;
import com.emissions.service.QueryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Aggregated CO2 emissions per business facility over a date range.
 *
 * <pre>
 * GET /api/emissions   (JSON body, kept for existing clients)
 * POST /api/emissions
 * {"startDate": "2023-01-01", "endDate": "2023-06-30", "businessFacility": ["GreenEat Changi"]}
 *
 * 200 [{"businessFacility": "GreenEat Changi", "totalEmissions": 123.4}]
 * </pre>
 *
 * The {@value #CACHE_HEADER} response header names the path that produced the answer.
 */
@RestController
@RequestMapping("/api/emissions")
public class EmissionsController {

    static final String CACHE_HEADER = "X-Emissions-Cache";

    private static final Logger log = LoggerFactory.getLogger(EmissionsController.class);

    private final EmissionsQueryService queryService;

    public EmissionsController(EmissionsQueryService queryService) {
        this.queryService = queryService;
    }

    @RequestMapping(method = {RequestMethod.GET, RequestMethod.POST},
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<FacilityEmissions>> getEmissions(@RequestBody EmissionsRequest request) {
        log.info("Emissions request: startDate={} endDate={} businessFacility={}",
                request.startDate(), request.endDate(), request.businessFacility());

        EmissionsQuery query = request.toQuery();
        QueryOutcome outcome = queryService.query(query);

        return ResponseEntity.ok()
                .header(CACHE_HEADER, outcome.source().name())
                .body(outcome.results());
    }
}
