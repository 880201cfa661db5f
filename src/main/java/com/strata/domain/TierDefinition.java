package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.Period;

/**
 * Load-time configuration of one tier inside a {@link TierTemplate}:
 * age threshold, partition granularity, storage location and compression codec.
 *
 * The age threshold is given either in months or in days; months win when both are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TierDefinition {

    @JsonProperty("age_months")
    private Integer ageMonths;

    @JsonProperty("age_days")
    private Integer ageDays;

    @JsonProperty("granularity")
    private Granularity granularity;

    @JsonProperty("location")
    private String location;

    @JsonProperty("codec")
    private String codec;

    public TierDefinition() {
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public boolean hasAgeThreshold() {
        return ageMonths != null || ageDays != null;
    }

    /**
     * Age threshold as a period, or null when none is configured.
     */
    @JsonIgnore
    public Period getAgeThreshold() {
        if (ageMonths != null) {
            return Period.ofMonths(ageMonths);
        }
        if (ageDays != null) {
            return Period.ofDays(ageDays);
        }
        return null;
    }

    /**
     * Date that lies one age threshold before the given reference date.
     */
    public LocalDate cutoffBefore(LocalDate reference) {
        return reference.minus(getAgeThreshold());
    }

    public static class Builder {
        private final TierDefinition definition = new TierDefinition();

        public Builder ageMonths(Integer ageMonths) {
            definition.ageMonths = ageMonths;
            return this;
        }

        public Builder ageDays(Integer ageDays) {
            definition.ageDays = ageDays;
            return this;
        }

        public Builder granularity(Granularity granularity) {
            definition.granularity = granularity;
            return this;
        }

        public Builder location(String location) {
            definition.location = location;
            return this;
        }

        public Builder codec(String codec) {
            definition.codec = codec;
            return this;
        }

        public TierDefinition build() {
            return definition;
        }
    }

    public Integer getAgeMonths() {
        return ageMonths;
    }

    public void setAgeMonths(Integer ageMonths) {
        this.ageMonths = ageMonths;
    }

    public Integer getAgeDays() {
        return ageDays;
    }

    public void setAgeDays(Integer ageDays) {
        this.ageDays = ageDays;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public void setGranularity(Granularity granularity) {
        this.granularity = granularity;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getCodec() {
        return codec;
    }

    public void setCodec(String codec) {
        this.codec = codec;
    }
}
