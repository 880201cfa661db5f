package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A named, boundary-addressable storage unit of a dataset, as reported by the storage engine.
 *
 * Boundaries are kept in the engine's textual form (for example {@code 2024-12-01} or
 * {@code TO_DATE(' 2024-12-01 00:00:00', ...)}); the lower bound is inclusive, the upper
 * bound exclusive. {@code MAXVALUE} marks an open upper bound.
 */
public class Partition {

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("lower_bound")
    private String lowerBound;

    @JsonProperty("upper_bound")
    private String upperBound;

    @JsonProperty("location")
    private String location;

    @JsonProperty("codec")
    private String codec;

    @JsonProperty("read_only")
    private boolean readOnly;

    @JsonProperty("row_count")
    private long rowCount;

    @JsonProperty("byte_size")
    private long byteSize;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("last_write_at")
    private Instant lastWriteAt;

    @JsonProperty("last_read_at")
    private Instant lastReadAt;

    public Partition() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lock and lookup key of the (dataset, partition) pair.
     */
    @JsonIgnore
    public String getKey() {
        return key(datasetId, name);
    }

    public static String key(String datasetId, String partitionName) {
        return datasetId + "." + partitionName;
    }

    public Builder toBuilder() {
        return new Builder()
            .datasetId(datasetId)
            .name(name)
            .lowerBound(lowerBound)
            .upperBound(upperBound)
            .location(location)
            .codec(codec)
            .readOnly(readOnly)
            .rowCount(rowCount)
            .byteSize(byteSize)
            .createdAt(createdAt)
            .lastWriteAt(lastWriteAt)
            .lastReadAt(lastReadAt);
    }

    public static class Builder {
        private final Partition partition = new Partition();

        public Builder datasetId(String datasetId) {
            partition.datasetId = datasetId;
            return this;
        }

        public Builder name(String name) {
            partition.name = name;
            return this;
        }

        public Builder lowerBound(String lowerBound) {
            partition.lowerBound = lowerBound;
            return this;
        }

        public Builder upperBound(String upperBound) {
            partition.upperBound = upperBound;
            return this;
        }

        public Builder location(String location) {
            partition.location = location;
            return this;
        }

        public Builder codec(String codec) {
            partition.codec = codec;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            partition.readOnly = readOnly;
            return this;
        }

        public Builder rowCount(long rowCount) {
            partition.rowCount = rowCount;
            return this;
        }

        public Builder byteSize(long byteSize) {
            partition.byteSize = byteSize;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            partition.createdAt = createdAt;
            return this;
        }

        public Builder lastWriteAt(Instant lastWriteAt) {
            partition.lastWriteAt = lastWriteAt;
            return this;
        }

        public Builder lastReadAt(Instant lastReadAt) {
            partition.lastReadAt = lastReadAt;
            return this;
        }

        public Partition build() {
            if (partition.datasetId == null || partition.name == null) {
                throw new IllegalArgumentException("Partition requires dataset and name");
            }
            return partition;
        }
    }

    public String getDatasetId() {
        return datasetId;
    }

    public void setDatasetId(String datasetId) {
        this.datasetId = datasetId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLowerBound() {
        return lowerBound;
    }

    public void setLowerBound(String lowerBound) {
        this.lowerBound = lowerBound;
    }

    public String getUpperBound() {
        return upperBound;
    }

    public void setUpperBound(String upperBound) {
        this.upperBound = upperBound;
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

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public long getRowCount() {
        return rowCount;
    }

    public void setRowCount(long rowCount) {
        this.rowCount = rowCount;
    }

    public long getByteSize() {
        return byteSize;
    }

    public void setByteSize(long byteSize) {
        this.byteSize = byteSize;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastWriteAt() {
        return lastWriteAt;
    }

    public void setLastWriteAt(Instant lastWriteAt) {
        this.lastWriteAt = lastWriteAt;
    }

    public Instant getLastReadAt() {
        return lastReadAt;
    }

    public void setLastReadAt(Instant lastReadAt) {
        this.lastReadAt = lastReadAt;
    }

    @Override
    public String toString() {
        return getKey() + "[" + lowerBound + ", " + upperBound + ") @" + location;
    }
}
