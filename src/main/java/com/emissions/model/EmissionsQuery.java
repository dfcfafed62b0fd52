package com.emissions.model;

import com.emissions.error.QueryValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Normalized, immutable aggregation request: an inclusive date range and a set of facilities.
 *
 * <p>Facilities are held sorted and de-duplicated so two requests that differ only in
 * facility order are equal.
 *
 * @param startDate  first transaction date included
 * @param endDate    last transaction date included
 * @param facilities business facilities to aggregate; may be empty
 */
public record EmissionsQuery(LocalDate startDate, LocalDate endDate, SortedSet<String> facilities) {

    private static final List<DateTimeFormatter> ACCEPTED_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ISO_DATE_TIME,
            DateTimeFormatter.ISO_DATE);

    public EmissionsQuery {
        if (startDate == null) throw new QueryValidationException("startDate is required");
        if (endDate == null) throw new QueryValidationException("endDate is required");
        if (startDate.isAfter(endDate)) {
            throw new QueryValidationException("startDate " + startDate + " is after endDate " + endDate);
        }
        if (facilities == null) throw new QueryValidationException("businessFacility must be a list");
        facilities = Collections.unmodifiableSortedSet(new TreeSet<>(facilities));
    }

    public EmissionsQuery(LocalDate startDate, LocalDate endDate, Collection<String> facilities) {
        this(startDate, endDate, toSortedSet(facilities));
    }

    /**
     * Build a query from raw request values. A missing facility list means no facilities.
     *
     * @throws QueryValidationException if either date is missing or unparseable, or the range is inverted
     */
    public static EmissionsQuery parse(String startDate, String endDate, Collection<String> facilities) {
        return new EmissionsQuery(
                parseDate("startDate", startDate),
                parseDate("endDate", endDate),
                facilities == null ? List.of() : facilities);
    }

    /**
     * Accepts {@code YYYY-MM-DD} or an ISO-8601 date-time, of which only the date is kept.
     */
    static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new QueryValidationException(field + " is required");
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : ACCEPTED_FORMATS) {
            try {
                return format.parse(trimmed, LocalDate::from);
            } catch (DateTimeParseException ignored) {
                // try the next accepted format
            }
        }
        throw new QueryValidationException(field + " is not an ISO-8601 date: " + value);
    }

    private static SortedSet<String> toSortedSet(Collection<String> facilities) {
        if (facilities == null) return null;
        TreeSet<String> sorted = new TreeSet<>();
        for (String facility : facilities) {
            if (facility == null) throw new QueryValidationException("businessFacility must not contain null");
            sorted.add(facility);
        }
        return sorted;
    }
}
