package com.emissions.scan;

import com.emissions.error.QueryCancelledException;
import com.emissions.key.CacheKeyDeriver;
import com.emissions.model.CacheEntry;
import com.emissions.model.EmissionsQuery;
import com.emissions.model.FacilityEmissions;
import com.emissions.model.QueryContext;
import com.emissions.store.CacheEntryCodec;
import com.emissions.store.EmissionsCacheStore;
import com.emissions.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OverlapScanner")
class OverlapScannerTest {

    private InMemoryKeyValueStore keyValueStore;
    private CacheEntryCodec codec;
    private EmissionsCacheStore cacheStore;
    private CacheKeyDeriver keyDeriver;

    private static FacilityEmissions row(String facility, double value) {
        return new FacilityEmissions(facility, value);
    }

    private static EmissionsQuery query(String start, String end, String... facilities) {
        return EmissionsQuery.parse(start, end, List.of(facilities));
    }

    private void cache(EmissionsQuery query, FacilityEmissions... results) {
        cacheStore.set(keyDeriver.deriveKey(query), CacheEntry.of(query, List.of(results)));
    }

    private OverlapScanner scanner(OverlapPolicy policy) {
        return new OverlapScanner(cacheStore, keyDeriver.keyPrefix(), policy);
    }

    @BeforeEach
    void setUp() {
        keyValueStore = new InMemoryKeyValueStore();
        codec = new CacheEntryCodec();
        cacheStore = new EmissionsCacheStore(keyValueStore, codec);
        keyDeriver = new CacheKeyDeriver(CacheKeyDeriver.DEFAULT_NAMESPACE);
    }

    @Nested
    @DisplayName("Scanning the cache namespace")
    class Scanning {

        @Test
        @DisplayName("entry intersecting in dates and facilities contributes its rows")
        void partialDateOverlapQualifies() {
            cache(query("2023-01-01", "2023-01-31", "A"), row("A", 10));

            List<FacilityEmissions> rows = scanner(OverlapPolicy.INCLUDE_ALL)
                    .findOverlapping(query("2023-01-15", "2023-02-15", "A"), QueryContext.unbounded());

            assertThat(rows).containsExactly(row("A", 10));
        }

        @Test
        @DisplayName("fragments reused for a different date range are counted, exact ranges are not")
        void partialReuseCounted() {
            cache(query("2023-01-01", "2023-01-31", "A"), row("A", 10));
            OverlapScanner scanner = scanner(OverlapPolicy.INCLUDE_ALL);

            scanner.findOverlapping(query("2023-01-01", "2023-01-31", "A", "B"), QueryContext.unbounded());
            assertThat(scanner.getPartialFragmentsReused()).isZero();

            scanner.findOverlapping(query("2023-01-15", "2023-02-15", "A"), QueryContext.unbounded());
            scanner.findOverlapping(query("2022-12-01", "2023-01-01", "A"), QueryContext.unbounded());
            assertThat(scanner.getPartialFragmentsReused()).isEqualTo(2);
        }

        @Test
        @DisplayName("entries for other facilities do not qualify")
        void disjointFacilitiesGiveNothing() {
            cache(query("2023-01-01", "2023-01-31", "A"), row("A", 10));
            cache(query("2023-02-01", "2023-02-28", "A"), row("A", 5));

            List<FacilityEmissions> rows = scanner(OverlapPolicy.INCLUDE_ALL)
                    .findOverlapping(query("2023-01-01", "2023-02-28", "B"), QueryContext.unbounded());

            assertThat(rows).isEmpty();
        }

        @Test
        @DisplayName("entries outside the date range do not qualify")
        void disjointDatesGiveNothing() {
            cache(query("2022-01-01", "2022-12-31", "A"), row("A", 99));

            List<FacilityEmissions> rows = scanner(OverlapPolicy.INCLUDE_ALL)
                    .findOverlapping(query("2023-01-01", "2023-01-31", "A"), QueryContext.unbounded());

            assertThat(rows).isEmpty();
        }

        @Test
        @DisplayName("a corrupt entry is skipped and the remaining entries are still evaluated")
        void corruptEntrySkipped() {
            cache(query("2023-01-01", "2023-01-10", "A"), row("A", 1));
            cache(query("2023-01-11", "2023-01-20", "A"), row("A", 2));
            cache(query("2023-01-21", "2023-01-31", "A"), row("A", 3));
            cache(query("2023-01-01", "2023-01-31", "A", "B"), row("A", 6), row("B", 4));
            keyValueStore.set("emissions:0000corrupt", "{\"start_date\": \"2023-01-01\", \"end_");

            List<FacilityEmissions> rows = scanner(OverlapPolicy.INCLUDE_ALL)
                    .findOverlapping(query("2023-01-01", "2023-01-31", "A"), QueryContext.unbounded());

            assertThat(keyValueStore.scanKeys("emissions:")).hasSize(5);
            assertThat(rows).containsExactlyInAnyOrder(row("A", 1), row("A", 2), row("A", 3), row("A", 6), row("B", 4));
        }

        @Test
        @DisplayName("keys outside the namespace are ignored")
        void otherNamespacesIgnored() {
            keyValueStore.set("sessions:abc", "not an entry");
            cache(query("2023-01-01", "2023-01-31", "A"), row("A", 10));

            List<FacilityEmissions> rows = scanner(OverlapPolicy.INCLUDE_ALL)
                    .findOverlapping(query("2023-01-01", "2023-01-31", "A"), QueryContext.unbounded());

            assertThat(rows).containsExactly(row("A", 10));
        }

        @Test
        @DisplayName("include-all keeps rows for facilities the query did not ask for")
        void includeAllKeepsForeignRows() {
            cache(query("2023-01-01", "2023-01-31", "A", "B"), row("A", 10), row("B", 7));

            List<FacilityEmissions> rows = scanner(OverlapPolicy.INCLUDE_ALL)
                    .findOverlapping(query("2023-01-01", "2023-01-31", "A"), QueryContext.unbounded());

            assertThat(rows).containsExactly(row("A", 10), row("B", 7));
        }

        @Test
        @DisplayName("clip-facilities drops rows for facilities the query did not ask for")
        void clipFacilitiesDropsForeignRows() {
            cache(query("2023-01-01", "2023-01-31", "A", "B"), row("A", 10), row("B", 7));

            List<FacilityEmissions> rows = scanner(OverlapPolicy.CLIP_FACILITIES)
                    .findOverlapping(query("2023-01-01", "2023-01-31", "A"), QueryContext.unbounded());

            assertThat(rows).containsExactly(row("A", 10));
        }

        @Test
        @DisplayName("a cancelled context aborts the scan with a cancellation failure")
        void cancelledContextAborts() {
            cache(query("2023-01-01", "2023-01-31", "A"), row("A", 10));
            QueryContext context = QueryContext.unbounded();
            context.cancel();

            assertThatThrownBy(() -> scanner(OverlapPolicy.INCLUDE_ALL)
                    .findOverlapping(query("2023-01-01", "2023-01-31", "A"), context))
                    .isInstanceOf(QueryCancelledException.class);
        }
    }

    @Nested
    @DisplayName("Overlap predicates")
    class Predicates {

        @ParameterizedTest(name = "[{0}..{1}] vs [{2}..{3}] overlap={4}")
        @CsvSource({
                "2023-01-01, 2023-01-31, 2023-01-15, 2023-02-15, true",
                "2023-01-01, 2023-01-31, 2023-01-31, 2023-02-15, true",
                "2023-01-01, 2023-01-31, 2023-02-01, 2023-02-15, false",
                "2023-01-10, 2023-01-20, 2023-01-01, 2023-01-31, true",
                "2023-01-01, 2023-01-01, 2023-01-01, 2023-01-01, true",
                "2022-12-01, 2022-12-31, 2023-01-01, 2023-01-31, false",
        })
        @DisplayName("date overlap is inclusive and commutative")
        void dateOverlapSymmetric(LocalDate s1, LocalDate e1, LocalDate s2, LocalDate e2, boolean expected) {
            assertThat(OverlapScanner.datesOverlap(s1, e1, s2, e2)).isEqualTo(expected);
            assertThat(OverlapScanner.datesOverlap(s2, e2, s1, e1)).isEqualTo(expected);
        }

        @Test
        @DisplayName("facility overlap needs at least one common facility")
        void facilityOverlap() {
            assertThat(OverlapScanner.facilitiesOverlap(List.of("A", "B"), List.of("B", "C"))).isTrue();
            assertThat(OverlapScanner.facilitiesOverlap(List.of("A"), List.of("B"))).isFalse();
            assertThat(OverlapScanner.facilitiesOverlap(List.of(), List.of("B"))).isFalse();
            assertThat(OverlapScanner.facilitiesOverlap(List.of("B", "C"), List.of("A", "B"))).isTrue();
        }

        @Test
        @DisplayName("policy labels resolve, unknown labels do not")
        void policyLabels() {
            assertThat(OverlapPolicy.fromLabel("include-all")).contains(OverlapPolicy.INCLUDE_ALL);
            assertThat(OverlapPolicy.fromLabel("clip-facilities")).contains(OverlapPolicy.CLIP_FACILITIES);
            assertThat(OverlapPolicy.fromLabel("exact")).isEmpty();
        }
    }
}
