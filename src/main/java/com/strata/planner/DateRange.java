package com.strata.planner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Observed min/max of a dataset's partitioning column, both inclusive.
 */
public class DateRange {

    @JsonProperty("min")
    private final LocalDate min;

    @JsonProperty("max")
    private final LocalDate max;

    @JsonCreator
    public DateRange(@JsonProperty("min") LocalDate min, @JsonProperty("max") LocalDate max) {
        this.min = min;
        this.max = max;
    }

    public static DateRange of(LocalDate min, LocalDate max) {
        return new DateRange(min, max);
    }

    public LocalDate getMin() {
        return min;
    }

    public LocalDate getMax() {
        return max;
    }

    public boolean isValid() {
        return min != null && max != null && !min.isAfter(max);
    }

    @Override
    public String toString() {
        return min + ".." + max;
    }
}
