package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Age or access derived classification of a partition.
 */
public enum Temperature {

    HOT("hot"),
    WARM("warm"),
    COLD("cold");

    private final String value;

    Temperature(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Temperature fromValue(String value) {
        for (Temperature temperature : Temperature.values()) {
            if (temperature.value.equalsIgnoreCase(value)) {
                return temperature;
            }
        }
        throw new IllegalArgumentException("Unknown Temperature value: " + value);
    }

    /**
     * Step function over the profile thresholds: {@code days < hot} is HOT,
     * {@code days < warm} is WARM, anything older is COLD.
     */
    public static Temperature fromAge(long ageDays, ThresholdProfile profile) {
        if (ageDays < profile.getHotDays()) {
            return HOT;
        } else if (ageDays < profile.getWarmDays()) {
            return WARM;
        } else {
            return COLD;
        }
    }
}
