package com.example.doimetadata.application.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Reads the timestamps stored on dataset records and renders them for the registration document.
 */
public final class DateValues {

    private DateValues() {
    }

    /**
     * Normalizes a raw timestamp.
     * <p>
     * {@code null} and blank strings yield {@code null}. Strings are read as an ISO date
     * ({@code 2021-05-10}), an ISO local date-time with a {@code T} or space separator
     * ({@code 2021-05-10 12:30:00.123456}) or an ISO offset date-time ({@code 2021-05-10T12:30:00Z}).
     *
     * @param raw value from the dataset record
     * @return {@link LocalDate}, {@link LocalDateTime}, {@link OffsetDateTime} or {@code null}
     * @throws DateTimeParseException   when a string matches none of the accepted formats
     * @throws IllegalArgumentException when the value is neither a string nor a supported temporal type
     */
    public static TemporalAccessor dateOrNull(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDate || raw instanceof LocalDateTime || raw instanceof OffsetDateTime) {
            return (TemporalAccessor) raw;
        }
        if (raw instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (!(raw instanceof String text)) {
            throw new IllegalArgumentException("Unsupported date value of type " + raw.getClass().getSimpleName());
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() == 10) {
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
        }
        String normalized = trimmed.length() > 10 && trimmed.charAt(10) == ' '
                ? trimmed.substring(0, 10) + 'T' + trimmed.substring(11)
                : trimmed;
        try {
            return LocalDateTime.parse(normalized, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException ex) {
            return OffsetDateTime.parse(normalized, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
    }

    /**
     * Renders a date value as ISO-8601 text; {@code null} renders as an empty string and
     * anything that is not a supported temporal type falls back to {@link String#valueOf(Object)}.
     *
     * @param value date value held in a {@code dates} entry
     * @return string form for the registration document
     */
    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        return String.valueOf(value);
    }
}
