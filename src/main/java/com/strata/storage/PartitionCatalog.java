package com.strata.storage;

import com.strata.domain.Partition;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of partition metadata kept by the storage engine.
 */
public interface PartitionCatalog {

    List<Partition> listPartitions(String datasetId);

    Optional<Partition> findPartition(String datasetId, String partitionName);

    PartitionMetrics partitionMetrics(Partition partition);

    /**
     * Last observed read/write times, when the engine tracks access.
     */
    Optional<AccessRecency> accessRecency(Partition partition);
}
