package com.emissions.service;

import com.emissions.aggregator.EmissionsAggregator;
import com.emissions.dataset.CsvEmissionsDataset;
import com.emissions.dataset.DatasetQueryFallback;
import com.emissions.key.CacheKeyDeriver;
import com.emissions.model.EmissionRecord;
import com.emissions.model.EmissionsQuery;
import com.emissions.model.FacilityEmissions;
import com.emissions.scan.OverlapPolicy;
import com.emissions.scan.OverlapScanner;
import com.emissions.store.CacheEntryCodec;
import com.emissions.store.EmissionsCacheStore;
import com.emissions.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that concurrent identical queries against an empty cache all succeed with the
 * same answer and leave exactly one entry behind.
 */
@DisplayName("EmissionsQueryService concurrency")
class ConcurrencyTest {

    @Test
    @DisplayName("Concurrent identical queries produce identical results with no exceptions")
    void concurrentIdenticalQueries() throws InterruptedException {
        List<EmissionRecord> rows = new ArrayList<>();
        for (int day = 1; day <= 28; day++) {
            rows.add(new EmissionRecord(LocalDate.of(2023, 2, day), "GreenEat Changi", day * 0.1));
            rows.add(new EmissionRecord(LocalDate.of(2023, 2, day), "GreenEat Orchard", day * 0.2));
        }

        ExecutorService workers = Executors.newFixedThreadPool(8);
        InMemoryKeyValueStore keyValueStore = new InMemoryKeyValueStore();
        CacheKeyDeriver keyDeriver = new CacheKeyDeriver(CacheKeyDeriver.DEFAULT_NAMESPACE);
        EmissionsCacheStore cacheStore = new EmissionsCacheStore(keyValueStore, new CacheEntryCodec());
        EmissionsAggregator aggregator = new EmissionsAggregator();
        EmissionsQueryService service = new EmissionsQueryService(
                keyDeriver,
                cacheStore,
                new OverlapScanner(cacheStore, keyDeriver.keyPrefix(), OverlapPolicy.INCLUDE_ALL),
                aggregator,
                new DatasetQueryFallback(CsvEmissionsDataset.of("test", rows), aggregator),
                new BoundedCalls(workers),
                10_000);

        EmissionsQuery query = EmissionsQuery.parse("2023-02-01", "2023-02-28",
                List.of("GreenEat Orchard", "GreenEat Changi"));

        int threads = 8;
        List<List<FacilityEmissions>> answers = Collections.synchronizedList(new ArrayList<>());
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        ExecutorService callers = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            callers.submit(() -> {
                try {
                    startLatch.await(); // Start all threads simultaneously
                    answers.add(service.query(query).results());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(doneLatch.await(15, TimeUnit.SECONDS)).isTrue();
        callers.shutdown();
        workers.shutdown();

        assertThat(failures).isEmpty();
        assertThat(answers).hasSize(threads);
        assertThat(answers).allSatisfy(answer -> assertThat(answer).isEqualTo(answers.get(0)));
        assertThat(answers.get(0)).extracting(FacilityEmissions::businessFacility)
                .containsExactly("GreenEat Changi", "GreenEat Orchard");
        assertThat(keyValueStore.scanKeys(keyDeriver.keyPrefix())).containsExactly(keyDeriver.deriveKey(query).value());
    }
}
