package com.strata.domain;

import java.time.LocalDate;
import java.time.DateTimeException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads partition boundary expressions as reported by storage engines.
 *
 * Accepts ISO dates ({@code 2024-12-01}), ISO date-times and the literal forms engines
 * print for range boundaries, such as {@code TO_DATE(' 2024-12-01 00:00:00', 'SYYYY-MM-DD HH24:MI:SS')}
 * or {@code TIMESTAMP' 2024-12-01 00:00:00'}. {@code MAXVALUE} is an open bound.
 */
public final class PartitionBoundaries {

    public static final String OPEN = "MAXVALUE";

    private static final Pattern DATE_PATTERN = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");

    private PartitionBoundaries() {
    }

    public static boolean isOpen(String boundary) {
        return boundary != null && OPEN.equalsIgnoreCase(boundary.trim());
    }

    /**
     * Date of the boundary, empty when it is open, missing or unreadable.
     */
    public static Optional<LocalDate> parse(String boundary) {
        if (boundary == null || isOpen(boundary)) {
            return Optional.empty();
        }
        Matcher matcher = DATE_PATTERN.matcher(boundary);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return date.toString();
    }
}
