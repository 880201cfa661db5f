package com.strata.policy;

import com.strata.classifier.PartitionAge;
import com.strata.domain.EvaluationQueueEntry;
import com.strata.domain.FailureKind;
import com.strata.domain.Partition;
import com.strata.domain.PartitionTemperature;
import com.strata.domain.Policy;
import com.strata.domain.QueueStatus;
import com.strata.domain.ResourceNotFoundException;
import com.strata.domain.ThresholdProfile;
import com.strata.execution.EngineConfig;
import com.strata.execution.EngineConfigService;
import com.strata.execution.PartitionLockRegistry;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.policy.EvaluationSummary.PairOutcome;
import com.strata.storage.EvaluationQueueRepository;
import com.strata.storage.MetadataStoreException;
import com.strata.storage.PartitionCatalog;
import com.strata.storage.PartitionTemperatureRepository;
import com.strata.storage.PolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Matches enabled policies against the partitions of their datasets and records the outcome
 * of every (policy, partition) pair in the evaluation queue.
 *
 * <p>A pair is left untouched while its partition is busy or its entry is RUNNING, while it is
 * blocked by a terminal failure under the current policy version, and for the minimum
 * re-evaluation interval after a success. Everything else is checked afresh and written as
 * PENDING (eligible) or SKIPPED (with the reason).
 */
@Service
public class PolicyEvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluationEngine.class);

    static final String BUSY_REASON = "Partition busy with an in-flight operation";

    private final PolicyRepository policyRepository;
    private final PartitionCatalog catalog;
    private final EvaluationQueueRepository queueRepository;
    private final PartitionTemperatureRepository temperatureRepository;
    private final ThresholdResolver thresholdResolver;
    private final EligibilityChecker eligibilityChecker;
    private final PartitionLockRegistry lockRegistry;
    private final EngineConfigService configService;
    private final LifecycleMetrics metrics;
    private final Clock clock;
    private final Duration pendingRetention;
    private final Duration completedRetention;

    public PolicyEvaluationEngine(PolicyRepository policyRepository,
                                  PartitionCatalog catalog,
                                  EvaluationQueueRepository queueRepository,
                                  PartitionTemperatureRepository temperatureRepository,
                                  ThresholdResolver thresholdResolver,
                                  EligibilityChecker eligibilityChecker,
                                  PartitionLockRegistry lockRegistry,
                                  EngineConfigService configService,
                                  LifecycleMetrics metrics,
                                  Clock clock,
                                  @Value("${strata.queue.pending-retention:P7D}") Duration pendingRetention,
                                  @Value("${strata.queue.completed-retention:P30D}") Duration completedRetention) {
        this.policyRepository = policyRepository;
        this.catalog = catalog;
        this.queueRepository = queueRepository;
        this.temperatureRepository = temperatureRepository;
        this.thresholdResolver = thresholdResolver;
        this.eligibilityChecker = eligibilityChecker;
        this.lockRegistry = lockRegistry;
        this.configService = configService;
        this.metrics = metrics;
        this.clock = clock;
        this.pendingRetention = pendingRetention;
        this.completedRetention = completedRetention;
    }

    /**
     * Evaluates every enabled policy against the current partitions of its dataset.
     * Stale queue rows are purged first; a failure on one policy or one partition is
     * counted and the pass carries on with the rest.
     *
     * @return counts of queued, skipped, unchanged and purged entries for this pass
     * @throws MetadataUnavailableException if the policy table cannot be read
     */
    public EvaluationSummary evaluateAll() {
        long startTime = System.currentTimeMillis();
        EvaluationSummary summary = new EvaluationSummary();
        summary.setPurged(purgeStaleEntries());

        List<Policy> policies = loadPolicies(policyRepository::findEnabled);
        log.info("Evaluating {} enabled policies", policies.size());
        for (Policy policy : policies) {
            evaluatePolicy(policy, summary);
        }
        return finish(summary, startTime);
    }

    /**
     * Manual trigger for a single policy, enabled or not.
     *
     * @param policyId ID of the policy to evaluate
     * @return counts for this policy's partitions
     * @throws ResourceNotFoundException if no policy has this ID
     */
    public EvaluationSummary evaluatePolicy(Long policyId) {
        long startTime = System.currentTimeMillis();
        Policy policy = loadPolicies(() -> policyRepository.findById(policyId)
            .map(Collections::singletonList)
            .orElseThrow(() -> new ResourceNotFoundException("policy", policyId)))
            .get(0);
        EvaluationSummary summary = new EvaluationSummary();
        evaluatePolicy(policy, summary);
        return finish(summary, startTime);
    }

    /**
     * Manual trigger for the enabled policies of one dataset.
     *
     * @param datasetId dataset whose policies are evaluated
     * @return counts over all of the dataset's policies
     */
    public EvaluationSummary evaluateDataset(String datasetId) {
        long startTime = System.currentTimeMillis();
        EvaluationSummary summary = new EvaluationSummary();
        List<Policy> policies = loadPolicies(policyRepository::findEnabled).stream()
            .filter(policy -> datasetId.equals(policy.getDatasetId()))
            .collect(Collectors.toList());
        for (Policy policy : policies) {
            evaluatePolicy(policy, summary);
        }
        return finish(summary, startTime);
    }

    private void evaluatePolicy(Policy policy, EvaluationSummary summary) {
        List<Partition> partitions;
        try {
            partitions = catalog.listPartitions(policy.getDatasetId());
        } catch (RuntimeException e) {
            log.error("Cannot list partitions of dataset {} for policy {}", policy.getDatasetId(), policy.getName(), e);
            summary.error();
            return;
        }
        summary.policyEvaluated();
        summary.addPurged(purgeDroppedPartitions(policy, partitions));

        ThresholdProfile profile = thresholdResolver.resolve(policy);
        Map<String, PartitionTemperature> snapshots = loadSnapshots(policy.getDatasetId());
        EngineConfig config = configService.current();
        Instant now = clock.instant();

        for (Partition partition : partitions) {
            try {
                summary.record(evaluatePair(policy, partition, profile, snapshots.get(partition.getName()), config, now));
            } catch (RuntimeException e) {
                log.error("Failed to evaluate policy {} against partition {}", policy.getName(), partition.getKey(), e);
                summary.error();
            }
        }
        log.debug("Policy {} evaluated against {} partitions of {} with profile {}",
            policy.getName(), partitions.size(), policy.getDatasetId(), profile);
    }

    PairOutcome evaluatePair(Policy policy, Partition partition, ThresholdProfile profile,
                             PartitionTemperature snapshot, EngineConfig config, Instant now) {
        Optional<EvaluationQueueEntry> existing =
            queueRepository.find(policy.getId(), partition.getDatasetId(), partition.getName());

        boolean running = existing.map(entry -> entry.getStatus() == QueueStatus.RUNNING).orElse(false);
        if (running || lockRegistry.isLocked(partition.getKey())) {
            if (existing.isEmpty()) {
                queueRepository.upsertEvaluation(entry(policy, partition, now)
                    .eligible(false)
                    .status(QueueStatus.SKIPPED)
                    .reason(BUSY_REASON)
                    .build());
            }
            return PairOutcome.BUSY;
        }

        if (existing.isPresent()) {
            EvaluationQueueEntry entry = existing.get();
            boolean sameVersion = entry.getPolicyVersion() == policy.getVersion();
            if (entry.getStatus() == QueueStatus.FAILED && entry.getFailureKind() == FailureKind.TERMINAL && sameVersion) {
                log.debug("Pair {}/{} blocked by terminal failure under version {}",
                    policy.getName(), partition.getKey(), entry.getPolicyVersion());
                return PairOutcome.BLOCKED;
            }
            if (entry.getStatus() == QueueStatus.SUCCESS && sameVersion
                && within(entry.getCompletedAt(), config.getMinReevaluationInterval(), now)) {
                return PairOutcome.RECENTLY_EXECUTED;
            }
            if (entry.getStatus() == QueueStatus.FAILED
                && within(entry.getCompletedAt(), config.getFailedRetryDelay(), now)) {
                return PairOutcome.RECENTLY_EXECUTED;
            }
        }

        EligibilityResult result = eligibilityChecker.check(policy, partition, profile, snapshot, now);
        boolean written = queueRepository.upsertEvaluation(entry(policy, partition, now)
            .eligible(result.isEligible())
            .status(result.isEligible() ? QueueStatus.PENDING : QueueStatus.SKIPPED)
            .reason(result.getReason())
            .build());
        if (!written) {
            return PairOutcome.BUSY;
        }
        if (result.isEligible()) {
            log.info("Queued {} of policy {} for partition {}", policy.getAction(), policy.getName(), partition.getKey());
            return PairOutcome.QUEUED;
        }
        log.debug("Skipped partition {} for policy {}: {}", partition.getKey(), policy.getName(), result.getReason());
        return PairOutcome.SKIPPED;
    }

    private EvaluationQueueEntry.Builder entry(Policy policy, Partition partition, Instant now) {
        return EvaluationQueueEntry.builder()
            .policyId(policy.getId())
            .policyName(policy.getName())
            .datasetId(partition.getDatasetId())
            .partitionName(partition.getName())
            .priority(policy.getPriority())
            .partitionBoundary(PartitionAge.sortBoundary(partition).orElse(null))
            .policyVersion(policy.getVersion())
            .evaluatedAt(now);
    }

    private static boolean within(Instant since, Duration interval, Instant now) {
        return since != null && !interval.isZero() && now.isBefore(since.plus(interval));
    }

    private List<Policy> loadPolicies(PolicyLoader loader) {
        try {
            return loader.load();
        } catch (MetadataStoreException e) {
            log.error("Policy table is unavailable, evaluation pass aborted", e);
            throw new MetadataUnavailableException("Cannot read lifecycle policies", "lifecycle_policy", e);
        }
    }

    private Map<String, PartitionTemperature> loadSnapshots(String datasetId) {
        try {
            return temperatureRepository.findByDataset(datasetId).stream()
                .collect(Collectors.toMap(PartitionTemperature::getPartitionName, Function.identity()));
        } catch (MetadataStoreException e) {
            log.warn("Temperature snapshots of {} unavailable, classifying by boundary age: {}", datasetId, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private int purgeStaleEntries() {
        try {
            return queueRepository.purgeStale(pendingRetention, completedRetention);
        } catch (MetadataStoreException e) {
            log.warn("Could not purge stale queue entries: {}", e.getMessage());
            return 0;
        }
    }

    private int purgeDroppedPartitions(Policy policy, List<Partition> partitions) {
        try {
            return queueRepository.purgeMissingPartitions(policy.getId(), policy.getDatasetId(),
                partitions.stream().map(Partition::getName).collect(Collectors.toList()));
        } catch (MetadataStoreException e) {
            log.warn("Could not purge queue entries of dropped partitions in {}: {}", policy.getDatasetId(), e.getMessage());
            return 0;
        }
    }

    private EvaluationSummary finish(EvaluationSummary summary, long startTime) {
        summary.setDurationMs(System.currentTimeMillis() - startTime);
        metrics.recordQueued(summary.getQueued());
        metrics.recordSkipped(summary.getSkipped());
        metrics.recordUnchanged(summary.getUnchanged());
        metrics.recordEvaluationErrors(summary.getErrors());
        metrics.recordPass("evaluation", summary.getDurationMs());
        log.info("Evaluation pass completed in {} ms: {}", summary.getDurationMs(), summary);
        return summary;
    }

    @FunctionalInterface
    private interface PolicyLoader {
        List<Policy> load();
    }
}
