package com.emissions.controller;

import com.emissions.dataset.EmissionsDataset;
import com.emissions.scan.OverlapScanner;
import com.emissions.service.EmissionsQueryService;
import com.emissions.store.EmissionsCacheStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and service introspection.
 */
@RestController
public class StatusController {

    private final EmissionsQueryService queryService;
    private final EmissionsCacheStore cacheStore;
    private final EmissionsDataset dataset;
    private final OverlapScanner overlapScanner;

    public StatusController(EmissionsQueryService queryService,
                            EmissionsCacheStore cacheStore,
                            EmissionsDataset dataset,
                            OverlapScanner overlapScanner) {
        this.queryService = queryService;
        this.cacheStore = cacheStore;
        this.dataset = dataset;
        this.overlapScanner = overlapScanner;
    }

    /**
     * Simple liveness check.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Dataset size, cache population, overlap policy and approximate reuse count.
     * Counting cached entries scans the namespace, so this call hits the store.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        String prefix = queryService.cacheKeyPrefix();
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().getEpochSecond(),
                "datasetRows", dataset.size(),
                "cachedEntries", cacheStore.countEntries(prefix),
                "cacheNamespace", prefix,
                "overlapPolicy", overlapScanner.getPolicy().getLabel(),
                "partialFragmentsReused", overlapScanner.getPartialFragmentsReused()
        ));
    }
}
