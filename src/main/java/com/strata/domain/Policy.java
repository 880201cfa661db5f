package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Declarative lifecycle rule: when every configured trigger condition holds for a
 * partition of the target dataset, the action is queued for that partition.
 *
 * Trigger conditions are age (days and/or calendar months since the partition's
 * boundary date), temperature, byte size bounds and a custom predicate. At least one
 * must be present; absent conditions are ignored.
 *
 * The version is bumped on every definition change. A terminal execution failure
 * blocks the (policy, partition) pair only while the version it failed under is current.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Policy {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 999;
    public static final int DEFAULT_PRIORITY = 100;

    @JsonProperty("policy_id")
    private Long id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("enabled")
    private boolean enabled = true;

    /**
     * Lower number is claimed first
     */
    @JsonProperty("priority")
    private int priority = DEFAULT_PRIORITY;

    @JsonProperty("age_days")
    private Integer ageDays;

    @JsonProperty("age_months")
    private Integer ageMonths;

    @JsonProperty("temperature")
    private Temperature temperature;

    @JsonProperty("min_size_bytes")
    private Long minSizeBytes;

    @JsonProperty("max_size_bytes")
    private Long maxSizeBytes;

    /**
     * SpEL predicate over partition attributes, e.g. {@code rowCount > 0 and !readOnly}
     */
    @JsonProperty("custom_condition")
    private String customCondition;

    @JsonProperty("action")
    private ActionType action;

    @JsonProperty("codec")
    private String codec;

    @JsonProperty("destination_tier")
    private StorageTier destinationTier;

    @JsonProperty("location")
    private String location;

    @JsonProperty("custom_action")
    private String customAction;

    @JsonProperty("rebuild_indexes")
    private boolean rebuildIndexes;

    @JsonProperty("gather_stats")
    private boolean gatherStats;

    @JsonProperty("threshold_profile_id")
    private Long thresholdProfileId;

    @JsonProperty("version")
    private int version = 1;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public Policy() {
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public boolean hasTriggerCondition() {
        return ageDays != null
            || ageMonths != null
            || temperature != null
            || minSizeBytes != null
            || maxSizeBytes != null
            || (customCondition != null && !customCondition.isBlank());
    }

    /**
     * Structural defects that make the policy unusable regardless of what it references.
     */
    public List<ValidationError> shapeErrors() {
        List<ValidationError> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationError("name", ValidationCode.NAME_REQUIRED, "Policy name is required"));
        }
        if (datasetId == null || datasetId.isBlank()) {
            errors.add(new ValidationError("dataset_id", ValidationCode.DATASET_REQUIRED, "Target dataset is required"));
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            errors.add(new ValidationError("priority", ValidationCode.PRIORITY_OUT_OF_RANGE,
                String.format("Priority %d is outside %d..%d", priority, MIN_PRIORITY, MAX_PRIORITY)));
        }
        if (!hasTriggerCondition()) {
            errors.add(new ValidationError("conditions", ValidationCode.NO_TRIGGER_CONDITION,
                "At least one trigger condition (age, temperature, size or custom condition) is required"));
        }
        if (ageDays != null && ageDays < 0) {
            errors.add(new ValidationError("age_days", ValidationCode.AGE_NEGATIVE, "age_days must not be negative"));
        }
        if (ageMonths != null && ageMonths < 0) {
            errors.add(new ValidationError("age_months", ValidationCode.AGE_NEGATIVE, "age_months must not be negative"));
        }
        if (minSizeBytes != null && minSizeBytes < 0) {
            errors.add(new ValidationError("min_size_bytes", ValidationCode.SIZE_NEGATIVE, "min_size_bytes must not be negative"));
        }
        if (maxSizeBytes != null && maxSizeBytes < 0) {
            errors.add(new ValidationError("max_size_bytes", ValidationCode.SIZE_NEGATIVE, "max_size_bytes must not be negative"));
        }
        if (minSizeBytes != null && maxSizeBytes != null && minSizeBytes > maxSizeBytes) {
            errors.add(new ValidationError("max_size_bytes", ValidationCode.SIZE_RANGE_INVALID,
                "max_size_bytes must not be less than min_size_bytes"));
        }
        errors.addAll(actionErrors());
        return errors;
    }

    private List<ValidationError> actionErrors() {
        List<ValidationError> errors = new ArrayList<>();
        if (action == null) {
            errors.add(new ValidationError("action", ValidationCode.ACTION_REQUIRED, "Action is required"));
            return errors;
        }
        if (!action.isPolicyAction()) {
            errors.add(new ValidationError("action", ValidationCode.ACTION_NOT_ALLOWED,
                "Action " + action + " cannot be configured on a policy"));
            return errors;
        }
        switch (action) {
            case COMPRESS:
                requireCodec(errors);
                break;
            case MOVE:
                requireCodec(errors);
                if (location == null || location.isBlank()) {
                    errors.add(new ValidationError("location", ValidationCode.LOCATION_REQUIRED,
                        "MOVE requires a target location"));
                }
                if (destinationTier == null) {
                    errors.add(new ValidationError("destination_tier", ValidationCode.DESTINATION_TIER_REQUIRED,
                        "MOVE requires a destination tier"));
                }
                break;
            case CUSTOM:
                if (customAction == null || customAction.isBlank()) {
                    errors.add(new ValidationError("custom_action", ValidationCode.CUSTOM_ACTION_REQUIRED,
                        "CUSTOM requires an action block"));
                }
                break;
            default:
                break;
        }
        return errors;
    }

    private void requireCodec(List<ValidationError> errors) {
        if (codec == null || codec.isBlank()) {
            errors.add(new ValidationError("codec", ValidationCode.CODEC_REQUIRED, action + " requires a codec"));
        }
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .datasetId(datasetId)
            .enabled(enabled)
            .priority(priority)
            .ageDays(ageDays)
            .ageMonths(ageMonths)
            .temperature(temperature)
            .minSizeBytes(minSizeBytes)
            .maxSizeBytes(maxSizeBytes)
            .customCondition(customCondition)
            .action(action)
            .codec(codec)
            .destinationTier(destinationTier)
            .location(location)
            .customAction(customAction)
            .rebuildIndexes(rebuildIndexes)
            .gatherStats(gatherStats)
            .thresholdProfileId(thresholdProfileId)
            .version(version)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static class Builder {
        private final Policy policy = new Policy();

        public Builder id(Long id) {
            policy.id = id;
            return this;
        }

        public Builder name(String name) {
            policy.name = name;
            return this;
        }

        public Builder datasetId(String datasetId) {
            policy.datasetId = datasetId;
            return this;
        }

        public Builder enabled(boolean enabled) {
            policy.enabled = enabled;
            return this;
        }

        public Builder priority(int priority) {
            policy.priority = priority;
            return this;
        }

        public Builder ageDays(Integer ageDays) {
            policy.ageDays = ageDays;
            return this;
        }

        public Builder ageMonths(Integer ageMonths) {
            policy.ageMonths = ageMonths;
            return this;
        }

        public Builder temperature(Temperature temperature) {
            policy.temperature = temperature;
            return this;
        }

        public Builder minSizeBytes(Long minSizeBytes) {
            policy.minSizeBytes = minSizeBytes;
            return this;
        }

        public Builder maxSizeBytes(Long maxSizeBytes) {
            policy.maxSizeBytes = maxSizeBytes;
            return this;
        }

        public Builder customCondition(String customCondition) {
            policy.customCondition = customCondition;
            return this;
        }

        public Builder action(ActionType action) {
            policy.action = action;
            return this;
        }

        public Builder codec(String codec) {
            policy.codec = codec;
            return this;
        }

        public Builder destinationTier(StorageTier destinationTier) {
            policy.destinationTier = destinationTier;
            return this;
        }

        public Builder location(String location) {
            policy.location = location;
            return this;
        }

        public Builder customAction(String customAction) {
            policy.customAction = customAction;
            return this;
        }

        public Builder rebuildIndexes(boolean rebuildIndexes) {
            policy.rebuildIndexes = rebuildIndexes;
            return this;
        }

        public Builder gatherStats(boolean gatherStats) {
            policy.gatherStats = gatherStats;
            return this;
        }

        public Builder thresholdProfileId(Long thresholdProfileId) {
            policy.thresholdProfileId = thresholdProfileId;
            return this;
        }

        public Builder version(int version) {
            policy.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            policy.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            policy.updatedAt = updatedAt;
            return this;
        }

        /**
         * @throws ValidationException listing every structural defect
         */
        public Policy build() {
            List<ValidationError> errors = policy.shapeErrors();
            if (!errors.isEmpty()) {
                throw new ValidationException("policy " + policy.name, errors);
            }
            return policy;
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

    public String getDatasetId() {
        return datasetId;
    }

    public void setDatasetId(String datasetId) {
        this.datasetId = datasetId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Integer getAgeDays() {
        return ageDays;
    }

    public void setAgeDays(Integer ageDays) {
        this.ageDays = ageDays;
    }

    public Integer getAgeMonths() {
        return ageMonths;
    }

    public void setAgeMonths(Integer ageMonths) {
        this.ageMonths = ageMonths;
    }

    public Temperature getTemperature() {
        return temperature;
    }

    public void setTemperature(Temperature temperature) {
        this.temperature = temperature;
    }

    public Long getMinSizeBytes() {
        return minSizeBytes;
    }

    public void setMinSizeBytes(Long minSizeBytes) {
        this.minSizeBytes = minSizeBytes;
    }

    public Long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    public void setMaxSizeBytes(Long maxSizeBytes) {
        this.maxSizeBytes = maxSizeBytes;
    }

    public String getCustomCondition() {
        return customCondition;
    }

    public void setCustomCondition(String customCondition) {
        this.customCondition = customCondition;
    }

    public ActionType getAction() {
        return action;
    }

    public void setAction(ActionType action) {
        this.action = action;
    }

    public String getCodec() {
        return codec;
    }

    public void setCodec(String codec) {
        this.codec = codec;
    }

    public StorageTier getDestinationTier() {
        return destinationTier;
    }

    public void setDestinationTier(StorageTier destinationTier) {
        this.destinationTier = destinationTier;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getCustomAction() {
        return customAction;
    }

    public void setCustomAction(String customAction) {
        this.customAction = customAction;
    }

    public boolean isRebuildIndexes() {
        return rebuildIndexes;
    }

    public void setRebuildIndexes(boolean rebuildIndexes) {
        this.rebuildIndexes = rebuildIndexes;
    }

    public boolean isGatherStats() {
        return gatherStats;
    }

    public void setGatherStats(boolean gatherStats) {
        this.gatherStats = gatherStats;
    }

    public Long getThresholdProfileId() {
        return thresholdProfileId;
    }

    public void setThresholdProfileId(Long thresholdProfileId) {
        this.thresholdProfileId = thresholdProfileId;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
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
        return "Policy[" + id + " " + name + " " + action + " on " + datasetId + "]";
    }
}
