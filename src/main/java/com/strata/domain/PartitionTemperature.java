package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Last persisted classification of a partition, refreshed by the classifier loop.
 * Access timestamps are the snapshot the access-based mode reads; they go stale
 * once {@code refreshedAt} is older than the configured bound.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PartitionTemperature {

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("partition_name")
    private String partitionName;

    @JsonProperty("temperature")
    private Temperature temperature;

    @JsonProperty("age_days")
    private Long ageDays;

    @JsonProperty("mode")
    private ClassificationMode mode;

    @JsonProperty("last_read_at")
    private Instant lastReadAt;

    @JsonProperty("last_write_at")
    private Instant lastWriteAt;

    @JsonProperty("warning")
    private String warning;

    @JsonProperty("refreshed_at")
    private Instant refreshedAt;

    public PartitionTemperature() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasAccessSignals() {
        return lastReadAt != null || lastWriteAt != null;
    }

    /**
     * Most recent of last read and last write, or null when neither was observed.
     */
    public Instant lastAccess() {
        if (lastReadAt == null) {
            return lastWriteAt;
        }
        if (lastWriteAt == null) {
            return lastReadAt;
        }
        return lastReadAt.isAfter(lastWriteAt) ? lastReadAt : lastWriteAt;
    }

    public Duration sinceRefresh(Instant now) {
        return refreshedAt == null ? null : Duration.between(refreshedAt, now);
    }

    public String recommendation() {
        if (temperature == null) {
            return null;
        }
        switch (temperature) {
            case COLD:
                return "Candidate for compression/archival";
            case WARM:
                return "Consider warm tier";
            default:
                return "Keep in hot tier";
        }
    }

    public static class Builder {
        private final PartitionTemperature snapshot = new PartitionTemperature();

        public Builder datasetId(String datasetId) {
            snapshot.datasetId = datasetId;
            return this;
        }

        public Builder partitionName(String partitionName) {
            snapshot.partitionName = partitionName;
            return this;
        }

        public Builder temperature(Temperature temperature) {
            snapshot.temperature = temperature;
            return this;
        }

        public Builder ageDays(Long ageDays) {
            snapshot.ageDays = ageDays;
            return this;
        }

        public Builder mode(ClassificationMode mode) {
            snapshot.mode = mode;
            return this;
        }

        public Builder lastReadAt(Instant lastReadAt) {
            snapshot.lastReadAt = lastReadAt;
            return this;
        }

        public Builder lastWriteAt(Instant lastWriteAt) {
            snapshot.lastWriteAt = lastWriteAt;
            return this;
        }

        public Builder warning(String warning) {
            snapshot.warning = warning;
            return this;
        }

        public Builder refreshedAt(Instant refreshedAt) {
            snapshot.refreshedAt = refreshedAt;
            return this;
        }

        public PartitionTemperature build() {
            return snapshot;
        }
    }

    public String getDatasetId() {
        return datasetId;
    }

    public void setDatasetId(String datasetId) {
        this.datasetId = datasetId;
    }

    public String getPartitionName() {
        return partitionName;
    }

    public void setPartitionName(String partitionName) {
        this.partitionName = partitionName;
    }

    public Temperature getTemperature() {
        return temperature;
    }

    public void setTemperature(Temperature temperature) {
        this.temperature = temperature;
    }

    public Long getAgeDays() {
        return ageDays;
    }

    public void setAgeDays(Long ageDays) {
        this.ageDays = ageDays;
    }

    public ClassificationMode getMode() {
        return mode;
    }

    public void setMode(ClassificationMode mode) {
        this.mode = mode;
    }

    public Instant getLastReadAt() {
        return lastReadAt;
    }

    public void setLastReadAt(Instant lastReadAt) {
        this.lastReadAt = lastReadAt;
    }

    public Instant getLastWriteAt() {
        return lastWriteAt;
    }

    public void setLastWriteAt(Instant lastWriteAt) {
        this.lastWriteAt = lastWriteAt;
    }

    public String getWarning() {
        return warning;
    }

    public void setWarning(String warning) {
        this.warning = warning;
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }

    public void setRefreshedAt(Instant refreshedAt) {
        this.refreshedAt = refreshedAt;
    }
}
