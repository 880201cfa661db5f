package com.strata.policy;

import com.strata.domain.Partition;

/**
 * Root object of custom conditions. Property names are the variables a condition can use.
 */
public class PartitionAttributes {

    private final String name;
    private final String dataset;
    private final Long ageDays;
    private final long rowCount;
    private final long byteSize;
    private final String location;
    private final String codec;
    private final boolean readOnly;

    public PartitionAttributes(Partition partition, Long ageDays) {
        this.name = partition.getName();
        this.dataset = partition.getDatasetId();
        this.ageDays = ageDays;
        this.rowCount = partition.getRowCount();
        this.byteSize = partition.getByteSize();
        this.location = partition.getLocation();
        this.codec = partition.getCodec();
        this.readOnly = partition.isReadOnly();
    }

    public String getName() {
        return name;
    }

    public String getDataset() {
        return dataset;
    }

    /**
     * Null when the partition boundary is unreadable.
     */
    public Long getAgeDays() {
        return ageDays;
    }

    public long getRowCount() {
        return rowCount;
    }

    public long getByteSize() {
        return byteSize;
    }

    public String getLocation() {
        return location;
    }

    public String getCodec() {
        return codec;
    }

    public boolean isReadOnly() {
        return readOnly;
    }
}
