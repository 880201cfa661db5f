package com.strata.classifier;

import com.strata.domain.ClassificationMode;
import com.strata.domain.Temperature;

/**
 * Temperature of one partition and how it was derived.
 */
public class ClassificationResult {

    private final Temperature temperature;
    private final Long ageDays;
    private final ClassificationMode mode;
    private final String warning;

    public ClassificationResult(Temperature temperature, Long ageDays, ClassificationMode mode, String warning) {
        this.temperature = temperature;
        this.ageDays = ageDays;
        this.mode = mode;
        this.warning = warning;
    }

    public Temperature getTemperature() {
        return temperature;
    }

    /**
     * Days since the boundary date, or since last access in ACCESS mode. Null when the boundary is unreadable.
     */
    public Long getAgeDays() {
        return ageDays;
    }

    public ClassificationMode getMode() {
        return mode;
    }

    public String getWarning() {
        return warning;
    }

    public boolean hasWarning() {
        return warning != null;
    }

    @Override
    public String toString() {
        return temperature + " (" + mode + (ageDays != null ? ", " + ageDays + "d" : "") + ")";
    }
}
