package com.strata.merge;

import com.strata.domain.ActionType;
import com.strata.domain.Dataset;
import com.strata.domain.DeferredMerge;
import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.Granularity;
import com.strata.domain.Partition;
import com.strata.domain.PartitionBoundaries;
import com.strata.domain.Policy;
import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import com.strata.execution.ExecutionFailureClassifier;
import com.strata.execution.PartitionLockRegistry;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.storage.DatasetRepository;
import com.strata.storage.ExecutionLogRepository;
import com.strata.storage.MergeBacklogRepository;
import com.strata.storage.PartitionCatalog;
import com.strata.storage.StorageEngine;
import com.strata.storage.TierTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consolidates fine partitions into the coarse partition of their period once they have
 * been moved into a tier with coarser granularity.
 *
 * <p>A merge needs a coarse partition starting at the period start, boundary adjacency
 * (the coarse upper bound equals the fine lower bound), a common location and no in-flight
 * operation on either partition. When one of these does not hold, or the storage engine
 * rejects the merge, the fine partition stays standalone and goes to the merge backlog.
 * Nothing here ever fails the move that triggered it.
 *
 * <p>Merges into the same coarse partition run one at a time.
 */
@Service
public class PartitionMergeScheduler {

    private static final Logger log = LoggerFactory.getLogger(PartitionMergeScheduler.class);

    private final PartitionCatalog catalog;
    private final StorageEngine storageEngine;
    private final DatasetRepository datasetRepository;
    private final TierTemplateRepository templateRepository;
    private final MergeBacklogRepository backlogRepository;
    private final ExecutionLogRepository logRepository;
    private final PartitionLockRegistry lockRegistry;
    private final ExecutionFailureClassifier failureClassifier;
    private final LifecycleMetrics metrics;

    // entries live only while a merge holds or waits for them
    private final Map<String, TargetLock> targetLocks = new ConcurrentHashMap<>();

    public PartitionMergeScheduler(PartitionCatalog catalog,
                                   StorageEngine storageEngine,
                                   DatasetRepository datasetRepository,
                                   TierTemplateRepository templateRepository,
                                   MergeBacklogRepository backlogRepository,
                                   ExecutionLogRepository logRepository,
                                   PartitionLockRegistry lockRegistry,
                                   ExecutionFailureClassifier failureClassifier,
                                   LifecycleMetrics metrics) {
        this.catalog = catalog;
        this.storageEngine = storageEngine;
        this.datasetRepository = datasetRepository;
        this.templateRepository = templateRepository;
        this.backlogRepository = backlogRepository;
        this.logRepository = logRepository;
        this.lockRegistry = lockRegistry;
        this.failureClassifier = failureClassifier;
        this.metrics = metrics;
    }

    /**
     * Post-move hook. Never throws; a failed merge leaves the partition standalone and in the backlog.
     *
     * @param policy    the MOVE policy that ran, whose destination tier sets the merge granularity
     * @param moved     the partition as it is after the move
     * @param trigger   trigger recorded on the merge's execution log entry
     * @param lockOwner owner of the busy lock the caller still holds on the moved partition
     * @return what happened to the partition
     */
    public MergeOutcome onMoveCompleted(Policy policy, Partition moved, ExecutionTrigger trigger, String lockOwner) {
        try {
            Optional<TierTemplate> template = templateOf(moved.getDatasetId());
            if (template.isEmpty()) {
                log.debug("Dataset {} has no tier template, no merge after moving {}", moved.getDatasetId(), moved.getName());
                return MergeOutcome.NOT_APPLICABLE;
            }
            StorageTier tier = policy.getDestinationTier() != null
                ? policy.getDestinationTier()
                : template.get().tierForLocation(moved.getLocation()).orElse(null);
            TierDefinition definition = tier != null ? template.get().tier(tier) : null;
            if (definition == null || definition.getGranularity() == null) {
                return MergeOutcome.NOT_APPLICABLE;
            }
            Granularity granularity = definition.getGranularity();
            Optional<LocalDate> lower = PartitionBoundaries.parse(moved.getLowerBound());
            Optional<LocalDate> upper = PartitionBoundaries.parse(moved.getUpperBound());
            if (lower.isEmpty() || upper.isEmpty()) {
                log.warn("Cannot merge {}: boundaries [{}, {}) are not dates", moved.getKey(),
                    moved.getLowerBound(), moved.getUpperBound());
                return MergeOutcome.NOT_APPLICABLE;
            }
            LocalDate periodStart = granularity.floor(lower.get());
            if (periodStart.equals(lower.get()) && !upper.get().isBefore(granularity.next(periodStart))) {
                // already spans a whole period of the destination tier
                return MergeOutcome.NOT_APPLICABLE;
            }
            return attemptMerge(moved.getDatasetId(), moved.getName(), tier, granularity, trigger, lockOwner);
        } catch (RuntimeException e) {
            log.error("Merge after moving {} failed, partition stays standalone", moved.getKey(), e);
            return MergeOutcome.FAILED;
        }
    }

    /**
     * Retries every deferred merge, least recently attempted first. Entries whose partition is gone, or which
     * now start their own period, leave the backlog; the rest are attempted again and stay
     * deferred when they still cannot run.
     *
     * @return number of partitions merged
     */
    public int retryBacklog() {
        long startTime = System.currentTimeMillis();
        List<DeferredMerge> backlog = backlogRepository.findAll();
        int merged = 0;
        for (DeferredMerge deferred : backlog) {
            try {
                MergeOutcome outcome = attemptMerge(deferred.getDatasetId(), deferred.getPartitionName(),
                    deferred.getTargetTier(), deferred.getTargetGranularity(), ExecutionTrigger.SCHEDULED, null);
                if (outcome == MergeOutcome.MERGED) {
                    merged++;
                }
            } catch (RuntimeException e) {
                log.error("Retry of deferred merge {}.{} failed", deferred.getDatasetId(), deferred.getPartitionName(), e);
            }
        }
        long duration = System.currentTimeMillis() - startTime;
        metrics.recordPass("merge", duration);
        log.info("Merge backlog pass completed in {} ms: {} of {} merged", duration, merged, backlog.size());
        return merged;
    }

    public List<DeferredMerge> backlog() {
        return backlogRepository.findAll();
    }

    MergeOutcome attemptMerge(String datasetId, String partitionName, StorageTier tier, Granularity granularity,
                              ExecutionTrigger trigger, String heldLockOwner) {
        Optional<Partition> fine = catalog.findPartition(datasetId, partitionName);
        if (fine.isEmpty()) {
            log.debug("Partition {}.{} no longer exists, dropping it from the merge backlog", datasetId, partitionName);
            backlogRepository.remove(datasetId, partitionName);
            return MergeOutcome.NOT_APPLICABLE;
        }
        Optional<LocalDate> lower = PartitionBoundaries.parse(fine.get().getLowerBound());
        if (lower.isEmpty()) {
            backlogRepository.remove(datasetId, partitionName);
            return MergeOutcome.NOT_APPLICABLE;
        }
        LocalDate periodStart = granularity.floor(lower.get());
        if (periodStart.equals(lower.get())) {
            log.info("Partition {} starts {} period {} and becomes its merge target", fine.get().getKey(),
                granularity.getValue(), periodStart);
            backlogRepository.remove(datasetId, partitionName);
            return MergeOutcome.SEED;
        }

        Optional<Partition> coarse = findPeriodPartition(datasetId, partitionName, periodStart);
        if (coarse.isEmpty()) {
            return defer(fine.get(), tier, granularity, "No partition found for period starting " + periodStart);
        }

        String targetKey = coarse.get().getKey();
        TargetLock targetLock = acquireTarget(targetKey);
        try {
            return mergeInto(coarse.get().getName(), fine.get(), tier, granularity, trigger, heldLockOwner);
        } finally {
            releaseTarget(targetKey, targetLock);
        }
    }

    private TargetLock acquireTarget(String targetKey) {
        TargetLock targetLock = targetLocks.compute(targetKey, (key, existing) -> {
            TargetLock lock = existing != null ? existing : new TargetLock();
            lock.users++;
            return lock;
        });
        targetLock.lock.lock();
        return targetLock;
    }

    private void releaseTarget(String targetKey, TargetLock targetLock) {
        targetLock.lock.unlock();
        targetLocks.computeIfPresent(targetKey, (key, existing) -> --existing.users == 0 ? null : existing);
    }

    int activeTargetLocks() {
        return targetLocks.size();
    }

    private MergeOutcome mergeInto(String coarseName, Partition staleFine, StorageTier tier, Granularity granularity,
                                   ExecutionTrigger trigger, String heldLockOwner) {
        String datasetId = staleFine.getDatasetId();
        // an earlier merge into the same target may have moved its upper bound
        Optional<Partition> currentFine = catalog.findPartition(datasetId, staleFine.getName());
        Optional<Partition> currentCoarse = catalog.findPartition(datasetId, coarseName);
        if (currentFine.isEmpty()) {
            backlogRepository.remove(datasetId, staleFine.getName());
            return MergeOutcome.NOT_APPLICABLE;
        }
        Partition fine = currentFine.get();
        if (currentCoarse.isEmpty()) {
            return defer(fine, tier, granularity, "Partition " + coarseName + " no longer exists");
        }
        Partition coarse = currentCoarse.get();

        Optional<LocalDate> coarseUpper = PartitionBoundaries.parse(coarse.getUpperBound());
        Optional<LocalDate> fineLower = PartitionBoundaries.parse(fine.getLowerBound());
        if (coarseUpper.isEmpty() || !coarseUpper.equals(fineLower)) {
            return defer(fine, tier, granularity, String.format("Partition %s ends at %s, not adjacent to %s starting at %s",
                coarse.getName(), coarse.getUpperBound(), fine.getName(), fine.getLowerBound()));
        }
        if (!coarse.getLocation().equals(fine.getLocation())) {
            return defer(fine, tier, granularity, String.format("Partition %s is in %s, %s is in %s",
                coarse.getName(), coarse.getLocation(), fine.getName(), fine.getLocation()));
        }

        String owner = "merge:" + fine.getKey();
        boolean fineHeld = heldLockOwner != null
            && lockRegistry.owner(fine.getKey()).map(heldLockOwner::equals).orElse(false);
        if (!fineHeld && !lockRegistry.tryLock(fine.getKey(), owner)) {
            return defer(fine, tier, granularity, "Partition " + fine.getName() + " is busy with an in-flight operation");
        }
        try {
            if (!lockRegistry.tryLock(coarse.getKey(), owner)) {
                return defer(fine, tier, granularity, "Partition " + coarse.getName() + " is busy with an in-flight operation");
            }
            try {
                return merge(coarse, fine, tier, granularity, trigger);
            } finally {
                lockRegistry.unlock(coarse.getKey(), owner);
            }
        } finally {
            if (!fineHeld) {
                lockRegistry.unlock(fine.getKey(), owner);
            }
        }
    }

    private MergeOutcome merge(Partition coarse, Partition fine, StorageTier tier, Granularity granularity,
                               ExecutionTrigger trigger) {
        ExecutionLogEntry entry = logRepository.start(ExecutionLogEntry.builder()
            .datasetId(fine.getDatasetId())
            .partitionName(fine.getName())
            .action(ActionType.MERGE)
            .trigger(trigger)
            .sizeBefore(fine.getByteSize())
            .locationBefore(fine.getLocation())
            .codecBefore(fine.getCodec())
            .detail("Merge into " + coarse.getName())
            .build());
        try {
            Partition merged = storageEngine.merge(coarse, fine);
            entry.setStatus(ExecutionStatus.SUCCESS);
            entry.setSizeAfter(merged.getByteSize());
            entry.setLocationAfter(merged.getLocation());
            entry.setCodecAfter(merged.getCodec());
            logRepository.complete(entry);
            backlogRepository.remove(fine.getDatasetId(), fine.getName());
            metrics.recordMerge();
            log.info("Merged {} into {}, which now spans [{}, {})", fine.getName(), merged.getName(),
                merged.getLowerBound(), merged.getUpperBound());
            return MergeOutcome.MERGED;
        } catch (RuntimeException e) {
            log.error("Storage engine rejected merge of {} into {}", fine.getKey(), coarse.getName(), e);
            entry.setStatus(ExecutionStatus.FAILED);
            entry.setErrorCode(failureClassifier.errorCode(e));
            entry.setErrorMessage(e.getMessage());
            entry.setFailureKind(failureClassifier.classify(e));
            logRepository.complete(entry);
            backlogRepository.defer(fine.getDatasetId(), fine.getName(), tier, granularity, "Merge failed: " + e.getMessage());
            metrics.recordMergeDeferred();
            return MergeOutcome.FAILED;
        }
    }

    private Optional<Partition> findPeriodPartition(String datasetId, String fineName, LocalDate periodStart) {
        return catalog.listPartitions(datasetId).stream()
            .filter(p -> !p.getName().equals(fineName))
            .filter(p -> PartitionBoundaries.parse(p.getLowerBound()).map(periodStart::equals).orElse(false))
            .findFirst();
    }

    private MergeOutcome defer(Partition fine, StorageTier tier, Granularity granularity, String reason) {
        log.warn("Merge of {} deferred: {}", fine.getKey(), reason);
        backlogRepository.defer(fine.getDatasetId(), fine.getName(), tier, granularity, reason);
        metrics.recordMergeDeferred();
        return MergeOutcome.DEFERRED;
    }

    private Optional<TierTemplate> templateOf(String datasetId) {
        return datasetRepository.findById(datasetId)
            .map(Dataset::getTierTemplate)
            .flatMap(templateRepository::findByName);
    }

    private static final class TargetLock {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        int users;
    }
}
