package com.strata.classifier;

import com.strata.domain.Dataset;
import com.strata.domain.Partition;
import com.strata.domain.PartitionTemperature;
import com.strata.domain.ThresholdProfile;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.policy.MetadataUnavailableException;
import com.strata.policy.ThresholdResolver;
import com.strata.storage.AccessRecency;
import com.strata.storage.DatasetRepository;
import com.strata.storage.MetadataStoreException;
import com.strata.storage.PartitionCatalog;
import com.strata.storage.PartitionTemperatureRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Refreshes the stored temperature snapshot of every partition: access recency from the
 * catalog plus the classification under the global default profile.
 *
 * Policies classify with their own profile at evaluation time and only read the access
 * signals from these snapshots.
 */
@Service
public class TemperatureRefreshService {

    private static final Logger log = LoggerFactory.getLogger(TemperatureRefreshService.class);

    private final DatasetRepository datasetRepository;
    private final PartitionCatalog catalog;
    private final PartitionTemperatureRepository temperatureRepository;
    private final TemperatureClassifier classifier;
    private final ThresholdResolver thresholdResolver;
    private final LifecycleMetrics metrics;
    private final Clock clock;

    public TemperatureRefreshService(DatasetRepository datasetRepository,
                                     PartitionCatalog catalog,
                                     PartitionTemperatureRepository temperatureRepository,
                                     TemperatureClassifier classifier,
                                     ThresholdResolver thresholdResolver,
                                     LifecycleMetrics metrics,
                                     Clock clock) {
        this.datasetRepository = datasetRepository;
        this.catalog = catalog;
        this.temperatureRepository = temperatureRepository;
        this.classifier = classifier;
        this.thresholdResolver = thresholdResolver;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return number of snapshots written
     * @throws MetadataUnavailableException if the dataset registry cannot be read
     */
    public int refreshAll() {
        long startTime = System.currentTimeMillis();
        List<Dataset> datasets;
        try {
            datasets = datasetRepository.findAll();
        } catch (MetadataStoreException e) {
            log.error("Dataset registry is unavailable, temperature refresh aborted", e);
            throw new MetadataUnavailableException("Cannot read dataset registry", "lifecycle_dataset", e);
        }
        int refreshed = 0;
        for (Dataset dataset : datasets) {
            try {
                refreshed += refreshDataset(dataset.getId());
            } catch (RuntimeException e) {
                log.error("Temperature refresh of dataset {} failed", dataset.getId(), e);
            }
        }
        long duration = System.currentTimeMillis() - startTime;
        metrics.recordPass("temperature-refresh", duration);
        log.info("Temperature refresh completed in {} ms: {} partitions across {} datasets",
            duration, refreshed, datasets.size());
        return refreshed;
    }

    public int refreshDataset(String datasetId) {
        List<Partition> partitions = catalog.listPartitions(datasetId);
        ThresholdProfile profile = thresholdResolver.defaultProfile();
        Instant now = clock.instant();
        Set<String> names = new HashSet<>();
        int refreshed = 0;
        for (Partition partition : partitions) {
            names.add(partition.getName());
            try {
                temperatureRepository.upsert(snapshot(partition, profile, now));
                refreshed++;
            } catch (RuntimeException e) {
                log.error("Failed to refresh temperature of partition {}", partition.getKey(), e);
            }
        }
        int removed = temperatureRepository.retainOnly(datasetId, names);
        if (removed > 0) {
            log.debug("Removed {} temperature rows of vanished partitions in {}", removed, datasetId);
        }
        metrics.recordTemperaturesRefreshed(refreshed);
        return refreshed;
    }

    public List<TemperatureView> temperatures(String datasetId) {
        Instant now = clock.instant();
        return temperatureRepository.findByDataset(datasetId).stream()
            .map(snapshot -> new TemperatureView(snapshot, now))
            .collect(Collectors.toList());
    }

    PartitionTemperature snapshot(Partition partition, ThresholdProfile profile, Instant now) {
        Optional<AccessRecency> recency = catalog.accessRecency(partition);
        PartitionTemperature snapshot = PartitionTemperature.builder()
            .datasetId(partition.getDatasetId())
            .partitionName(partition.getName())
            .lastReadAt(recency.map(AccessRecency::getLastRead).orElse(partition.getLastReadAt()))
            .lastWriteAt(recency.map(AccessRecency::getLastWrite).orElse(partition.getLastWriteAt()))
            .refreshedAt(now)
            .build();
        ClassificationResult result = classifier.classify(partition, profile, snapshot, now);
        snapshot.setTemperature(result.getTemperature());
        snapshot.setAgeDays(result.getAgeDays());
        snapshot.setMode(result.getMode());
        snapshot.setWarning(result.getWarning());
        return snapshot;
    }
}
