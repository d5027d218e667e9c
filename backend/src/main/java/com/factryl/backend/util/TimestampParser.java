package com.factryl.backend.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

/**
 * Parses the timestamp formats collectors send for {@code published}.
 * Zone-less values are read as UTC. Never throws.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> ZONED_FORMATTERS = Arrays.asList(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.RFC_1123_DATE_TIME
    );
    private static final List<DateTimeFormatter> LOCAL_FORMATTERS = Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss")
    );

    private TimestampParser() {
    }

    public static ParsedTimestamp parse(String value) {
        if (value == null || value.isBlank()) {
            return ParsedTimestamp.invalid();
        }
        String text = value.trim();

        for (DateTimeFormatter formatter : ZONED_FORMATTERS) {
            try {
                return ParsedTimestamp.of(ZonedDateTime.parse(text, formatter).toInstant());
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        for (DateTimeFormatter formatter : LOCAL_FORMATTERS) {
            try {
                return ParsedTimestamp.of(LocalDateTime.parse(text, formatter).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        try {
            return ParsedTimestamp.of(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return ParsedTimestamp.invalid();
        }
    }

    /**
     * ISO-8601 form used when a default "now" is written into an item.
     */
    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
