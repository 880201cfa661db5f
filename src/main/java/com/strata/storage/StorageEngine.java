package com.strata.storage;

import com.strata.domain.Partition;
import com.strata.domain.PartitionSpec;

import java.util.List;

/**
 * Operations the underlying storage engine performs on partitions.
 *
 * Every call is synchronous and may run from sub-second to hours. Implementations signal
 * failures with {@link StorageOperationException}; any other runtime exception is
 * classified by the caller.
 */
public interface StorageEngine {

    List<Partition> createPartitions(String datasetId, List<PartitionSpec> specs);

    /**
     * Recompress in place.
     */
    Partition setCodec(Partition partition, String codec);

    /**
     * Move to another location, recompressing on the way.
     */
    Partition relocate(Partition partition, String location, String codec);

    Partition sealReadOnly(Partition partition);

    void drop(Partition partition);

    /**
     * Remove all rows but keep the partition and its boundaries.
     */
    Partition truncate(Partition partition);

    /**
     * Merge two boundary-adjacent partitions. The result keeps the first partition's
     * name, codec and location and spans both.
     */
    Partition merge(Partition coarse, Partition fine);

    Partition executeCustom(Partition partition, String actionBlock);

    default void rebuildIndexes(Partition partition) {
    }

    default void gatherStatistics(Partition partition) {
    }
}
