package com.strata.storage;

public class PartitionMetrics {

    private final long rows;
    private final long bytes;

    public PartitionMetrics(long rows, long bytes) {
        this.rows = rows;
        this.bytes = bytes;
    }

    public long getRows() {
        return rows;
    }

    public long getBytes() {
        return bytes;
    }
}
