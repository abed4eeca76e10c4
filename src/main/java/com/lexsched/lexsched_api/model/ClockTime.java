package com.lexsched.lexsched_api.model;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Parses wall-clock times as written in timetables: {@code 8:00}, {@code 13:30} or {@code 08:00 AM}.
 */
public final class ClockTime {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ofPattern("H:mm"),
            DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("h:mma", Locale.ENGLISH));

    public static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    private ClockTime() {
    }

    public static LocalTime parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Time must not be blank.");
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (DateTimeFormatter format : FORMATS) {
            try {
                return LocalTime.parse(normalized, format);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        throw new IllegalArgumentException("Unrecognized time '" + text + "'; expected e.g. 8:00, 13:30 or 08:00 AM.");
    }
}
