package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Boundary definition for a partition to be created: {@code [lower, upper)} plus the
 * tier, location and codec it is created in.
 */
public class PartitionSpec {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("lower_bound")
    private final LocalDate lower;

    @JsonProperty("upper_bound")
    private final LocalDate upper;

    @JsonProperty("tier")
    private final StorageTier tier;

    @JsonProperty("granularity")
    private final Granularity granularity;

    @JsonProperty("location")
    private final String location;

    @JsonProperty("codec")
    private final String codec;

    /**
     * Whole partition lies beyond the COLD age threshold
     */
    @JsonProperty("past_cold_horizon")
    private final boolean pastColdHorizon;

    public PartitionSpec(String name, LocalDate lower, LocalDate upper, StorageTier tier,
                         Granularity granularity, String location, String codec, boolean pastColdHorizon) {
        if (!lower.isBefore(upper)) {
            throw new IllegalArgumentException("Partition lower bound " + lower + " must precede upper bound " + upper);
        }
        this.name = name;
        this.lower = lower;
        this.upper = upper;
        this.tier = tier;
        this.granularity = granularity;
        this.location = location;
        this.codec = codec;
        this.pastColdHorizon = pastColdHorizon;
    }

    public String getName() {
        return name;
    }

    public LocalDate getLower() {
        return lower;
    }

    public LocalDate getUpper() {
        return upper;
    }

    public StorageTier getTier() {
        return tier;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public String getLocation() {
        return location;
    }

    public String getCodec() {
        return codec;
    }

    public boolean isPastColdHorizon() {
        return pastColdHorizon;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartitionSpec that = (PartitionSpec) o;
        return lower.equals(that.lower) && upper.equals(that.upper) && tier == that.tier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper, tier);
    }

    @Override
    public String toString() {
        return name + "[" + lower + ", " + upper + ") " + tier + " " + location + "/" + codec;
    }
}
