package com.strata.storage;

import com.strata.domain.FailureKind;
import com.strata.domain.Partition;
import com.strata.domain.PartitionBoundaries;
import com.strata.domain.PartitionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage engine and partition catalog kept in memory.
 *
 * Used when no real engine is wired in, and as the engine behind the end-to-end tests.
 * Byte size after recompression follows the ratio registered for the codec (unchanged when
 * none is registered). When locations are registered, relocating anywhere else fails terminally.
 */
public class InMemoryStorageEngine implements StorageEngine, PartitionCatalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageEngine.class);

    private final Map<String, Map<String, Partition>> datasets = new HashMap<>();
    private final Map<String, Double> codecRatios = new HashMap<>();
    private final Set<String> knownLocations = new HashSet<>();
    private final Clock clock;

    public InMemoryStorageEngine(Clock clock) {
        this.clock = clock;
    }

    public synchronized void registerCodecRatio(String codec, double ratio) {
        codecRatios.put(codec, ratio);
    }

    public synchronized void registerLocation(String location) {
        knownLocations.add(location);
    }

    public synchronized void addPartition(Partition partition) {
        datasets.computeIfAbsent(partition.getDatasetId(), k -> new LinkedHashMap<>())
            .put(partition.getName(), copy(partition));
    }

    public synchronized void recordRead(String datasetId, String partitionName, Instant at) {
        Partition partition = require("read", datasetId, partitionName);
        partition.setLastReadAt(at);
    }

    public synchronized void recordWrite(String datasetId, String partitionName, Instant at) {
        Partition partition = require("write", datasetId, partitionName);
        partition.setLastWriteAt(at);
    }

    @Override
    public synchronized List<Partition> createPartitions(String datasetId, List<PartitionSpec> specs) {
        Map<String, Partition> partitions = datasets.computeIfAbsent(datasetId, k -> new LinkedHashMap<>());
        List<Partition> created = new ArrayList<>();
        for (PartitionSpec spec : specs) {
            if (partitions.containsKey(spec.getName())) {
                throw new StorageOperationException("Partition already exists", "create",
                    Partition.key(datasetId, spec.getName()), FailureKind.TERMINAL);
            }
            Partition partition = Partition.builder()
                .datasetId(datasetId)
                .name(spec.getName())
                .lowerBound(PartitionBoundaries.format(spec.getLower()))
                .upperBound(PartitionBoundaries.format(spec.getUpper()))
                .location(spec.getLocation())
                .codec(spec.getCodec())
                .createdAt(clock.instant())
                .build();
            partitions.put(partition.getName(), partition);
            created.add(copy(partition));
        }
        log.debug("Created {} partitions for dataset {}", created.size(), datasetId);
        return created;
    }

    @Override
    public synchronized Partition setCodec(Partition partition, String codec) {
        Partition stored = require("set_codec", partition.getDatasetId(), partition.getName());
        stored.setByteSize(recompressedSize(stored, codec));
        stored.setCodec(codec);
        return copy(stored);
    }

    @Override
    public synchronized Partition relocate(Partition partition, String location, String codec) {
        Partition stored = require("relocate", partition.getDatasetId(), partition.getName());
        if (!knownLocations.isEmpty() && !knownLocations.contains(location)) {
            throw new StorageOperationException("Unknown target location " + location, "relocate",
                stored.getKey(), FailureKind.TERMINAL);
        }
        stored.setByteSize(recompressedSize(stored, codec));
        stored.setLocation(location);
        stored.setCodec(codec);
        return copy(stored);
    }

    @Override
    public synchronized Partition sealReadOnly(Partition partition) {
        Partition stored = require("seal_read_only", partition.getDatasetId(), partition.getName());
        stored.setReadOnly(true);
        return copy(stored);
    }

    @Override
    public synchronized void drop(Partition partition) {
        require("drop", partition.getDatasetId(), partition.getName());
        datasets.get(partition.getDatasetId()).remove(partition.getName());
    }

    @Override
    public synchronized Partition truncate(Partition partition) {
        Partition stored = require("truncate", partition.getDatasetId(), partition.getName());
        stored.setRowCount(0);
        stored.setByteSize(0);
        return copy(stored);
    }

    @Override
    public synchronized Partition merge(Partition coarse, Partition fine) {
        Partition target = require("merge", coarse.getDatasetId(), coarse.getName());
        Partition source = require("merge", fine.getDatasetId(), fine.getName());
        if (!target.getLocation().equals(source.getLocation())) {
            throw new StorageOperationException("Partitions are in different locations", "merge",
                source.getKey(), FailureKind.TERMINAL);
        }
        if (target.getUpperBound().equals(source.getLowerBound())) {
            target.setUpperBound(source.getUpperBound());
        } else if (source.getUpperBound().equals(target.getLowerBound())) {
            target.setLowerBound(source.getLowerBound());
        } else {
            throw new StorageOperationException("Partitions are not adjacent", "merge",
                source.getKey(), FailureKind.TERMINAL);
        }
        target.setRowCount(target.getRowCount() + source.getRowCount());
        target.setByteSize(target.getByteSize() + source.getByteSize());
        datasets.get(source.getDatasetId()).remove(source.getName());
        return copy(target);
    }

    @Override
    public synchronized Partition executeCustom(Partition partition, String actionBlock) {
        Partition stored = require("custom", partition.getDatasetId(), partition.getName());
        log.info("Custom action on {}: {}", stored.getKey(), actionBlock);
        return copy(stored);
    }

    @Override
    public synchronized List<Partition> listPartitions(String datasetId) {
        List<Partition> result = new ArrayList<>();
        for (Partition partition : datasets.getOrDefault(datasetId, Map.of()).values()) {
            result.add(copy(partition));
        }
        result.sort(Comparator.comparing(p -> PartitionBoundaries.parse(p.getLowerBound()).orElse(LocalDate.MIN)));
        return result;
    }

    @Override
    public synchronized Optional<Partition> findPartition(String datasetId, String partitionName) {
        Partition partition = datasets.getOrDefault(datasetId, Map.of()).get(partitionName);
        return Optional.ofNullable(partition).map(this::copy);
    }

    @Override
    public synchronized PartitionMetrics partitionMetrics(Partition partition) {
        Partition stored = require("metrics", partition.getDatasetId(), partition.getName());
        return new PartitionMetrics(stored.getRowCount(), stored.getByteSize());
    }

    @Override
    public synchronized Optional<AccessRecency> accessRecency(Partition partition) {
        Partition stored = datasets.getOrDefault(partition.getDatasetId(), Map.of()).get(partition.getName());
        if (stored == null || (stored.getLastReadAt() == null && stored.getLastWriteAt() == null)) {
            return Optional.empty();
        }
        return Optional.of(new AccessRecency(stored.getLastReadAt(), stored.getLastWriteAt()));
    }

    private Partition require(String operation, String datasetId, String partitionName) {
        Partition partition = datasets.getOrDefault(datasetId, Map.of()).get(partitionName);
        if (partition == null) {
            throw new PartitionNotFoundException(operation, Partition.key(datasetId, partitionName));
        }
        return partition;
    }

    private long recompressedSize(Partition partition, String codec) {
        Double ratio = codecRatios.get(codec);
        return ratio == null ? partition.getByteSize() : Math.round(partition.getByteSize() * ratio);
    }

    private Partition copy(Partition partition) {
        return partition.toBuilder().build();
    }
}
