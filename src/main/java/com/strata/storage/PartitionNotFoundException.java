package com.strata.storage;

import com.strata.domain.FailureKind;

/**
 * The partition no longer exists in the storage engine.
 */
public class PartitionNotFoundException extends StorageOperationException {

    public PartitionNotFoundException(String operation, String partitionKey) {
        super("Partition does not exist", operation, partitionKey, FailureKind.TERMINAL);
    }
}
