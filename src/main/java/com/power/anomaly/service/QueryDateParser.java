package com.power.anomaly.service;

import com.power.anomaly.exception.InvalidRangeException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

/**
 * Parses the date bounds of a range query. Accepts {@code 2007-01-15T08:30[:00]},
 * {@code 2007-01-15 08:30[:00]} or a bare {@code 2007-01-15}; a bare end date covers the whole day.
 * Record timestamps carry no zone and are compared as UTC.
 */
public final class QueryDateParser {

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private QueryDateParser() {}

    public static Instant parseStart(String value) {
        return parse(value, "start_date", LocalTime.MIN);
    }

    public static Instant parseEnd(String value) {
        return parse(value, "end_date", LocalTime.MAX);
    }

    private static Instant parse(String value, String name, LocalTime dateOnlyTime) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atTime(dateOnlyTime).toInstant(ZoneOffset.UTC);
            }
            // exactly one separator between date and time
            DateTimeFormatter formatter = trimmed.length() > 10 && trimmed.charAt(10) == ' '
                    ? SPACE_SEPARATED
                    : DateTimeFormatter.ISO_LOCAL_DATE_TIME;
            return LocalDateTime.parse(trimmed, formatter).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException("Invalid " + name + " format: '" + value
                    + "' (expected yyyy-MM-dd or yyyy-MM-dd'T'HH:mm[:ss])");
        }
    }
}
