package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reusable per-tier layout used when a dataset is first partitioned.
 *
 * Stored as a JSON document. The Tier Boundary Planner consumes it at load time,
 * and the Execution Engine consults it to keep MOVE targets consistent with known tiers.
 */
public class TierTemplate {

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("hot")
    private TierDefinition hot;

    @JsonProperty("warm")
    private TierDefinition warm;

    @JsonProperty("cold")
    private TierDefinition cold;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public TierTemplate() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Definition of the given tier, or null when the template omits it.
     */
    public TierDefinition tier(StorageTier tier) {
        switch (tier) {
            case HOT:
                return hot;
            case WARM:
                return warm;
            case COLD:
                return cold;
            default:
                throw new IllegalArgumentException("Unknown tier " + tier);
        }
    }

    @JsonIgnore
    public Map<StorageTier, TierDefinition> getTiers() {
        Map<StorageTier, TierDefinition> tiers = new EnumMap<>(StorageTier.class);
        for (StorageTier tier : StorageTier.values()) {
            TierDefinition definition = tier(tier);
            if (definition != null) {
                tiers.put(tier, definition);
            }
        }
        return tiers;
    }

    /**
     * Finds the tier whose location is the given one.
     */
    public Optional<StorageTier> tierForLocation(String location) {
        for (Map.Entry<StorageTier, TierDefinition> entry : getTiers().entrySet()) {
            if (location != null && location.equalsIgnoreCase(entry.getValue().getLocation())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public static class Builder {
        private final TierTemplate template = new TierTemplate();

        public Builder name(String name) {
            template.name = name;
            return this;
        }

        public Builder description(String description) {
            template.description = description;
            return this;
        }

        public Builder hot(TierDefinition hot) {
            template.hot = hot;
            return this;
        }

        public Builder warm(TierDefinition warm) {
            template.warm = warm;
            return this;
        }

        public Builder cold(TierDefinition cold) {
            template.cold = cold;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            template.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            template.updatedAt = updatedAt;
            return this;
        }

        public TierTemplate build() {
            return template;
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TierDefinition getHot() {
        return hot;
    }

    public void setHot(TierDefinition hot) {
        this.hot = hot;
    }

    public TierDefinition getWarm() {
        return warm;
    }

    public void setWarm(TierDefinition warm) {
        this.warm = warm;
    }

    public TierDefinition getCold() {
        return cold;
    }

    public void setCold(TierDefinition cold) {
        this.cold = cold;
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
}
