package com.lexsched.lexsched_api.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses registrar-style day codes ({@code MWF}, {@code TTH}, {@code TR}, {@code W}, ...)
 * into the set of days a slot meets on.
 */
public final class DayPattern {

    // Two-letter codes must be tried before their one-letter prefixes.
    private static final List<String> CODES = List.of("TH", "SA", "SU", "M", "T", "W", "R", "F");

    private DayPattern() {}

    public static Set<DayOfWeek> parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Day pattern must not be blank.");
        }
        String remaining = pattern.trim().toUpperCase(Locale.ROOT);
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        int pos = 0;
        outer:
        while (pos < remaining.length()) {
            for (String code : CODES) {
                if (remaining.startsWith(code, pos)) {
                    days.add(toDay(code));
                    pos += code.length();
                    continue outer;
                }
            }
            throw new IllegalArgumentException("Unrecognized day code at position " + pos + " in '" + pattern + "'.");
        }
        return Collections.unmodifiableSet(days);
    }

    private static DayOfWeek toDay(String code) {
        switch (code) {
            case "M": return DayOfWeek.MONDAY;
            case "T": return DayOfWeek.TUESDAY;
            case "W": return DayOfWeek.WEDNESDAY;
            case "TH":
            case "R": return DayOfWeek.THURSDAY;
            case "F": return DayOfWeek.FRIDAY;
            case "SA": return DayOfWeek.SATURDAY;
            case "SU": return DayOfWeek.SUNDAY;
            default: throw new IllegalArgumentException("Unknown day code: " + code);
        }
    }
}
