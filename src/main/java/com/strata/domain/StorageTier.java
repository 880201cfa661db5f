package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Storage tiers a partition can be placed in.
 * Each tier carries its own location and compression codec, configured per dataset
 * through a {@link TierTemplate}.
 */
public enum StorageTier {

    /**
     * Recent, frequently written data on fast storage with light or no compression
     */
    HOT("hot", "Recent data on fast storage"),

    /**
     * Aging data, read occasionally, moderately compressed
     */
    WARM("warm", "Aging data, moderately compressed"),

    /**
     * Historical data on the cheapest storage with the strongest compression
     */
    COLD("cold", "Historical data, archival compression");

    private final String value;
    private final String description;

    StorageTier(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse a string value to StorageTier
     */
    @JsonCreator
    public static StorageTier fromValue(String value) {
        for (StorageTier tier : StorageTier.values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown StorageTier value: " + value);
    }

    /**
     * The temperature a partition placed in this tier is expected to have.
     */
    public Temperature expectedTemperature() {
        return Temperature.valueOf(name());
    }
}
