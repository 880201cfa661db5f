package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * Partitioning interval. Boundaries are always aligned to the start of the interval
 * (midnight, Monday, first of month, first of quarter, January 1st).
 */
public enum Granularity {

    DAILY("daily", 1),
    WEEKLY("weekly", 7),
    MONTHLY("monthly", 30),
    QUARTERLY("quarterly", 91),
    YEARLY("yearly", 365);

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final String value;
    private final int approximateDays;

    Granularity(String value, int approximateDays) {
        this.value = value;
        this.approximateDays = approximateDays;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getApproximateDays() {
        return approximateDays;
    }

    @JsonCreator
    public static Granularity fromValue(String value) {
        for (Granularity granularity : Granularity.values()) {
            if (granularity.value.equalsIgnoreCase(value) || granularity.name().equalsIgnoreCase(value)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown Granularity value: " + value);
    }

    /**
     * Start of the interval containing the given date.
     */
    public LocalDate floor(LocalDate date) {
        switch (this) {
            case DAILY:
                return date;
            case WEEKLY:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY:
                return date.withDayOfMonth(1);
            case QUARTERLY:
                int firstMonthOfQuarter = ((date.getMonthValue() - 1) / 3) * 3 + 1;
                return LocalDate.of(date.getYear(), firstMonthOfQuarter, 1);
            case YEARLY:
                return date.withDayOfYear(1);
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    /**
     * Advances an aligned boundary by one interval.
     */
    public LocalDate next(LocalDate boundary) {
        switch (this) {
            case DAILY:
                return boundary.plusDays(1);
            case WEEKLY:
                return boundary.plusWeeks(1);
            case MONTHLY:
                return boundary.plusMonths(1);
            case QUARTERLY:
                return boundary.plusMonths(3);
            case YEARLY:
                return boundary.plusYears(1);
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    public boolean isCoarserThan(Granularity other) {
        return approximateDays > other.approximateDays;
    }

    /**
     * Conventional partition name for an interval starting at the given boundary.
     */
    public String partitionName(LocalDate lower) {
        switch (this) {
            case YEARLY:
                return String.format("P_%d", lower.getYear());
            case QUARTERLY:
                return String.format("P_%d_Q%d", lower.getYear(), (lower.getMonthValue() - 1) / 3 + 1);
            case MONTHLY:
                return String.format("P_%d_%02d", lower.getYear(), lower.getMonthValue());
            default:
                return "P_" + lower.format(DAY_FORMAT);
        }
    }

    /**
     * Finds the granularity whose single interval exactly spans {@code [lower, upper)}.
     * Clipped or merged partitions have no exact granularity.
     */
    public static Optional<Granularity> ofSpan(LocalDate lower, LocalDate upper) {
        for (Granularity granularity : values()) {
            if (granularity.floor(lower).equals(lower) && granularity.next(lower).equals(upper)) {
                return Optional.of(granularity);
            }
        }
        return Optional.empty();
    }
}
