package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A time-partitioned dataset under lifecycle management.
 */
public class Dataset {

    @JsonProperty("dataset_id")
    private String id;

    @JsonProperty("display_name")
    private String displayName;

    /**
     * Date column the dataset is range-partitioned by
     */
    @JsonProperty("partition_column")
    private String partitionColumn;

    /**
     * Tier template used for the initial layout and for post-move merges; may be null
     */
    @JsonProperty("tier_template")
    private String tierTemplate;

    @JsonProperty("created_at")
    private Instant createdAt;

    public Dataset() {
    }

    public Dataset(String id, String tierTemplate) {
        this.id = id;
        this.displayName = id;
        this.tierTemplate = tierTemplate;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Dataset dataset = new Dataset();

        public Builder id(String id) {
            dataset.id = id;
            return this;
        }

        public Builder displayName(String displayName) {
            dataset.displayName = displayName;
            return this;
        }

        public Builder partitionColumn(String partitionColumn) {
            dataset.partitionColumn = partitionColumn;
            return this;
        }

        public Builder tierTemplate(String tierTemplate) {
            dataset.tierTemplate = tierTemplate;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            dataset.createdAt = createdAt;
            return this;
        }

        public Dataset build() {
            if (dataset.displayName == null) {
                dataset.displayName = dataset.id;
            }
            return dataset;
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getPartitionColumn() {
        return partitionColumn;
    }

    public void setPartitionColumn(String partitionColumn) {
        this.partitionColumn = partitionColumn;
    }

    public String getTierTemplate() {
        return tierTemplate;
    }

    public void setTierTemplate(String tierTemplate) {
        this.tierTemplate = tierTemplate;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
