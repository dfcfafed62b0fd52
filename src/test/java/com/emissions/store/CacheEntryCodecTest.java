package com.emissions.store;

import com.emissions.error.CorruptCacheEntryException;
import com.emissions.error.ErrorKind;
import com.emissions.model.CacheEntry;
import com.emissions.model.FacilityEmissions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CacheEntryCodec")
class CacheEntryCodecTest {

    private final CacheEntryCodec codec = new CacheEntryCodec();

    @Test
    @DisplayName("encodes the wire field names and ISO dates")
    void encodesWireFormat() {
        CacheEntry entry = new CacheEntry(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 1, 31),
                List.of("GreenEat Changi"), List.of(new FacilityEmissions("GreenEat Changi", 10.5)));

        String json = codec.encode(entry);

        assertThat(json).isEqualTo("{\"start_date\":\"2023-01-01\",\"end_date\":\"2023-01-31\","
                + "\"facilities\":[\"GreenEat Changi\"],"
                + "\"results\":[{\"businessFacility\":\"GreenEat Changi\",\"totalEmissions\":10.5}]}");
    }

    @Test
    @DisplayName("decodes an entry written by the existing Python service")
    void decodesPythonEntry() {
        String json = "{\"start_date\": \"2023-01-01\", \"end_date\": \"2023-03-01\", "
                + "\"facilities\": [\"GreenEat Changi\", \"GreenEat Orchard\"], "
                + "\"results\": [{\"businessFacility\": \"GreenEat Changi\", \"totalEmissions\": 30.0}, "
                + "{\"businessFacility\": \"GreenEat Orchard\", \"totalEmissions\": 7.5}]}";

        CacheEntry entry = codec.decode("emissions:x", json);

        assertThat(entry.startDate()).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(entry.endDate()).isEqualTo(LocalDate.of(2023, 3, 1));
        assertThat(entry.facilities()).containsExactly("GreenEat Changi", "GreenEat Orchard");
        assertThat(entry.results()).containsExactly(
                new FacilityEmissions("GreenEat Changi", 30.0),
                new FacilityEmissions("GreenEat Orchard", 7.5));
    }

    @Test
    @DisplayName("decoding what was encoded gives back an equal entry")
    void decodeOfEncode() {
        CacheEntry entry = new CacheEntry(LocalDate.of(2023, 2, 1), LocalDate.of(2023, 2, 28),
                List.of("A", "B"), List.of(new FacilityEmissions("A", 0.1 + 0.2), new FacilityEmissions("B", 1e-9)));

        assertThat(codec.decode("emissions:x", codec.encode(entry))).isEqualTo(entry);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "null",
            "not json",
            "[1, 2, 3]",
            "{\"start_date\": \"2023-01-01\"",
            "{\"start_date\": \"2023-01-01\", \"end_date\": \"2023-01-31\", \"facilities\": [\"A\"]}",
            "{\"start_date\": \"2023-13-45\", \"end_date\": \"2023-01-31\", \"facilities\": [\"A\"], \"results\": []}",
            "{\"start_date\": \"2023-01-01\", \"end_date\": \"2023-01-31\", \"facilities\": [\"A\"], "
                    + "\"results\": [{\"businessFacility\": \"A\", \"totalEmissions\": null}]}",
            "{\"start_date\": \"2023-01-01\", \"end_date\": \"2023-01-31\", \"facilities\": [\"A\"], "
                    + "\"results\": [{\"totalEmissions\": 1.0}]}",
    })
    @DisplayName("malformed or incomplete values are reported as corrupt entries")
    void corruptValues(String json) {
        assertThatThrownBy(() -> codec.decode("emissions:bad", json))
                .isInstanceOf(CorruptCacheEntryException.class)
                .satisfies(e -> {
                    CorruptCacheEntryException corrupt = (CorruptCacheEntryException) e;
                    assertThat(corrupt.getKey()).isEqualTo("emissions:bad");
                    assertThat(corrupt.kind()).isEqualTo(ErrorKind.CORRUPT_CACHE_ENTRY);
                });
    }
}
