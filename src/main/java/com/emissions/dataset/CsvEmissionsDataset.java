package com.emissions.dataset;

import com.emissions.error.DatasetComputeException;
import com.emissions.model.EmissionRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Emission rows loaded once from a CSV export with the columns
 * {@code TRANSACTION DATE}, {@code Business Facility} and {@code CO2_ITEM}.
 *
 * <p>Rows whose date or value does not parse are skipped and counted. If the file
 * cannot be read at all the dataset is kept in an unavailable state and every lookup
 * fails with {@link DatasetComputeException}, so startup does not depend on the file.
 */
public class CsvEmissionsDataset implements EmissionsDataset {

    private static final Logger log = LoggerFactory.getLogger(CsvEmissionsDataset.class);

    static final String DATE_COLUMN = "TRANSACTION DATE";
    static final String FACILITY_COLUMN = "Business Facility";
    static final String VALUE_COLUMN = "CO2_ITEM";

    /** Two-digit years 69..99 are 1969..1999 and 00..68 are 2000..2068, as in strptime's %y. */
    static final int TWO_DIGIT_YEAR_BASE = 1969;

    private final String source;
    private final List<EmissionRecord> rows;
    private final Exception loadFailure;

    private CsvEmissionsDataset(String source, List<EmissionRecord> rows, Exception loadFailure) {
        this.source = source;
        this.rows = rows;
        this.loadFailure = loadFailure;
    }

    public static CsvEmissionsDataset of(String source, List<EmissionRecord> rows) {
        return new CsvEmissionsDataset(source, List.copyOf(rows), null);
    }

    /**
     * @param resource    CSV file with a header row
     * @param datePattern {@link DateTimeFormatter} pattern of the date column, e.g. {@code d/M/yy}
     */
    public static CsvEmissionsDataset load(Resource resource, String datePattern) {
        String source = resource.getDescription();
        if (!resource.exists()) {
            log.warn("Emissions dataset not found: {}. Dataset queries will fail until it is provided.", source);
            return new CsvEmissionsDataset(source, List.of(), new FileNotFoundException(source));
        }
        try (InputStream in = resource.getInputStream()) {
            List<EmissionRecord> rows = parse(in, dateFormatter(datePattern));
            log.info("Loaded {} emission rows from {}", rows.size(), source);
            return new CsvEmissionsDataset(source, rows, null);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load emissions dataset from {}", source, e);
            return new CsvEmissionsDataset(source, List.of(), e);
        }
    }

    /**
     * Formatter for the date column. A two-digit {@code yy} year is resolved against
     * {@link #TWO_DIGIT_YEAR_BASE} instead of {@code java.time}'s 2000..2099 window.
     */
    static DateTimeFormatter dateFormatter(String datePattern) {
        int year = datePattern.indexOf("yy");
        if (year < 0 || datePattern.contains("yyy")) {
            return DateTimeFormatter.ofPattern(datePattern);
        }
        return new DateTimeFormatterBuilder()
                .appendPattern(datePattern.substring(0, year))
                .appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE)
                .appendPattern(datePattern.substring(year + 2))
                .toFormatter();
    }

    static List<EmissionRecord> parse(InputStream in, DateTimeFormatter dateFormat) throws IOException {
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        List<EmissionRecord> rows = new ArrayList<>();
        int skipped = 0;
        boolean headerChecked = false;
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            while (it.hasNextValue()) {
                Map<String, String> line = it.nextValue();
                if (!headerChecked) {
                    requireColumns(line);
                    headerChecked = true;
                }
                String date = line.get(DATE_COLUMN);
                String facility = line.get(FACILITY_COLUMN);
                String value = line.get(VALUE_COLUMN);
                if (date == null || facility == null || value == null || value.isBlank()) {
                    skipped++;
                    continue;
                }
                try {
                    rows.add(new EmissionRecord(
                            LocalDate.parse(date.trim(), dateFormat),
                            facility,
                            Double.parseDouble(value.trim())));
                } catch (DateTimeParseException | NumberFormatException e) {
                    skipped++;
                    log.debug("Skipping unparseable row {}: {}", line, e.getMessage());
                }
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} unparseable rows while loading emissions dataset", skipped);
        }
        return rows;
    }

    private static void requireColumns(Map<String, String> firstLine) throws IOException {
        for (String column : List.of(DATE_COLUMN, FACILITY_COLUMN, VALUE_COLUMN)) {
            if (!firstLine.containsKey(column)) {
                throw new IOException("Missing column '" + column + "', found " + firstLine.keySet());
            }
        }
    }

    @Override
    public List<EmissionRecord> findRows(LocalDate from, LocalDate to, Set<String> facilities) {
        if (loadFailure != null) {
            throw new DatasetComputeException("Emissions dataset " + source + " is unavailable", loadFailure);
        }
        return rows.stream()
                .filter(row -> !row.transactionDate().isBefore(from) && !row.transactionDate().isAfter(to))
                .filter(row -> facilities.contains(row.businessFacility()))
                .toList();
    }

    @Override
    public int size() {
        return loadFailure != null ? -1 : rows.size();
    }

    public boolean isAvailable() {
        return loadFailure == null;
    }
}
