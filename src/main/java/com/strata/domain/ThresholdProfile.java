package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Named, reusable age boundaries (in days) for temperature classification.
 *
 * Thresholds must be positive and strictly ascending: hot &lt; warm &lt; cold.
 * A policy without a profile reference is classified under the global default profile.
 */
public class ThresholdProfile {

    public static final String DEFAULT_NAME = "DEFAULT";

    @JsonProperty("profile_id")
    private Long id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("hot_days")
    private int hotDays;

    @JsonProperty("warm_days")
    private int warmDays;

    @JsonProperty("cold_days")
    private int coldDays;

    @JsonProperty("description")
    private String description;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public ThresholdProfile() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks threshold ordering. Empty when the profile is usable.
     */
    public List<ValidationError> validationErrors() {
        List<ValidationError> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationError("name", ValidationCode.NAME_REQUIRED, "Profile name is required"));
        }
        if (hotDays <= 0 || warmDays <= 0 || coldDays <= 0) {
            errors.add(new ValidationError("hot_days", ValidationCode.THRESHOLD_NOT_POSITIVE,
                String.format("Thresholds must be positive (hot=%d, warm=%d, cold=%d)", hotDays, warmDays, coldDays)));
        }
        if (hotDays >= warmDays) {
            errors.add(new ValidationError("warm_days", ValidationCode.THRESHOLDS_NOT_ASCENDING,
                String.format("hot_days (%d) must be less than warm_days (%d)", hotDays, warmDays)));
        }
        if (warmDays >= coldDays) {
            errors.add(new ValidationError("cold_days", ValidationCode.THRESHOLDS_NOT_ASCENDING,
                String.format("warm_days (%d) must be less than cold_days (%d)", warmDays, coldDays)));
        }
        return errors;
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .hotDays(hotDays)
            .warmDays(warmDays)
            .coldDays(coldDays)
            .description(description)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static class Builder {
        private final ThresholdProfile profile = new ThresholdProfile();

        public Builder id(Long id) {
            profile.id = id;
            return this;
        }

        public Builder name(String name) {
            profile.name = name;
            return this;
        }

        public Builder hotDays(int hotDays) {
            profile.hotDays = hotDays;
            return this;
        }

        public Builder warmDays(int warmDays) {
            profile.warmDays = warmDays;
            return this;
        }

        public Builder coldDays(int coldDays) {
            profile.coldDays = coldDays;
            return this;
        }

        public Builder description(String description) {
            profile.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            profile.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            profile.updatedAt = updatedAt;
            return this;
        }

        /**
         * @throws ValidationException if the thresholds are not positive and strictly ascending
         */
        public ThresholdProfile build() {
            List<ValidationError> errors = profile.validationErrors();
            if (!errors.isEmpty()) {
                throw new ValidationException("threshold profile " + profile.name, errors);
            }
            return profile;
        }
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getHotDays() {
        return hotDays;
    }

    public void setHotDays(int hotDays) {
        this.hotDays = hotDays;
    }

    public int getWarmDays() {
        return warmDays;
    }

    public void setWarmDays(int warmDays) {
        this.warmDays = warmDays;
    }

    public int getColdDays() {
        return coldDays;
    }

    public void setColdDays(int coldDays) {
        this.coldDays = coldDays;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return name + "(" + hotDays + "/" + warmDays + "/" + coldDays + ")";
    }
}
