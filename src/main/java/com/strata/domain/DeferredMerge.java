package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A fine partition left standalone after a move, waiting to be merged into its coarse period.
 */
public class DeferredMerge {

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("partition_name")
    private String partitionName;

    @JsonProperty("target_tier")
    private StorageTier targetTier;

    @JsonProperty("target_granularity")
    private Granularity targetGranularity;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("attempts")
    private int attempts;

    @JsonProperty("first_deferred_at")
    private Instant firstDeferredAt;

    @JsonProperty("last_attempt_at")
    private Instant lastAttemptAt;

    public DeferredMerge() {
    }

    public DeferredMerge(String datasetId, String partitionName, StorageTier targetTier,
                         Granularity targetGranularity, String reason, int attempts,
                         Instant firstDeferredAt, Instant lastAttemptAt) {
        this.datasetId = datasetId;
        this.partitionName = partitionName;
        this.targetTier = targetTier;
        this.targetGranularity = targetGranularity;
        this.reason = reason;
        this.attempts = attempts;
        this.firstDeferredAt = firstDeferredAt;
        this.lastAttemptAt = lastAttemptAt;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public String getPartitionName() {
        return partitionName;
    }

    public StorageTier getTargetTier() {
        return targetTier;
    }

    public Granularity getTargetGranularity() {
        return targetGranularity;
    }

    public String getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getFirstDeferredAt() {
        return firstDeferredAt;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }
}
