package com.strata.storage;

import com.strata.domain.FailureKind;

/**
 * Failure reported by the storage engine for one partition operation.
 */
public class StorageOperationException extends RuntimeException {

    private final String operation;
    private final String partitionKey;
    private final FailureKind failureKind;

    public StorageOperationException(String message, String operation, String partitionKey, FailureKind failureKind) {
        super(message);
        this.operation = operation;
        this.partitionKey = partitionKey;
        this.failureKind = failureKind;
    }

    public StorageOperationException(String message, String operation, String partitionKey,
                                     FailureKind failureKind, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.partitionKey = partitionKey;
        this.failureKind = failureKind;
    }

    public String getOperation() {
        return operation;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (operation != null) {
            sb.append(" [Operation: ").append(operation).append("]");
        }
        if (partitionKey != null) {
            sb.append(" [Partition: ").append(partitionKey).append("]");
        }
        return sb.toString();
    }
}
