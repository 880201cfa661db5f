package com.strata.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Busy marks on partitions. At most one owner holds a partition key at any time; the
 * evaluation engine leaves busy partitions alone and the merge scheduler refuses them.
 *
 * Keys are {@code dataset.partition}.
 */
@Component
public class PartitionLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(PartitionLockRegistry.class);

    private final Map<String, String> owners = new ConcurrentHashMap<>();

    /**
     * @return true if the caller now holds the key
     */
    public boolean tryLock(String partitionKey, String owner) {
        String current = owners.putIfAbsent(partitionKey, owner);
        if (current != null) {
            log.debug("Partition {} is busy ({}), {} refused", partitionKey, current, owner);
            return false;
        }
        return true;
    }

    /**
     * Releases the key if {@code owner} holds it.
     */
    public boolean unlock(String partitionKey, String owner) {
        boolean released = owners.remove(partitionKey, owner);
        if (!released) {
            log.warn("Partition {} was not held by {}, nothing released", partitionKey, owner);
        }
        return released;
    }

    public boolean isLocked(String partitionKey) {
        return owners.containsKey(partitionKey);
    }

    public Optional<String> owner(String partitionKey) {
        return Optional.ofNullable(owners.get(partitionKey));
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(owners);
    }
}
