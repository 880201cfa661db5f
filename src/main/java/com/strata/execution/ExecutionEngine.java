package com.strata.execution;

import com.strata.domain.ActionType;
import com.strata.domain.EvaluationQueueEntry;
import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.FailureKind;
import com.strata.domain.Partition;
import com.strata.domain.Policy;
import com.strata.domain.QueueStatus;
import com.strata.merge.MergeOutcome;
import com.strata.merge.PartitionMergeScheduler;
import com.strata.monitoring.FailureAlertMonitor;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.policy.MetadataUnavailableException;
import com.strata.storage.EvaluationQueueRepository;
import com.strata.storage.ExecutionLogRepository;
import com.strata.storage.MetadataStoreException;
import com.strata.storage.PartitionCatalog;
import com.strata.storage.PolicyRepository;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Claims PENDING queue entries in priority order and runs their actions on a bounded
 * worker pool.
 *
 * <p>Before claiming an entry the dispatcher takes the partition's busy lock, so no two
 * actions ever touch the same partition. Every action is bracketed by an execution log entry
 * and is bounded by the configured timeout. A timed-out action is recorded as a retryable
 * failure and an operator is alerted, but the storage call itself is never interrupted: the
 * partition stays busy until the call actually returns.
 *
 * <p>Stop requests, a closing execution window and disabling auto-execution only prevent
 * new claims; running actions always finish.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String STOP_REQUESTED = "Stop requested";
    static final String AUTO_EXECUTION_DISABLED = "Auto-execution disabled";
    static final String PASS_IN_PROGRESS = "Another execution pass is running";

    private final EvaluationQueueRepository queueRepository;
    private final PolicyRepository policyRepository;
    private final PartitionCatalog catalog;
    private final ExecutionLogRepository logRepository;
    private final ActionExecutor actionExecutor;
    private final ExecutionFailureClassifier failureClassifier;
    private final PartitionLockRegistry lockRegistry;
    private final EngineConfigService configService;
    private final PartitionMergeScheduler mergeScheduler;
    private final FailureAlertMonitor alertMonitor;
    private final LifecycleMetrics metrics;
    private final Clock clock;

    private final ReentrantLock passLock = new ReentrantLock();
    private final ExecutorService storageExecutor = Executors.newCachedThreadPool(namedThreads("strata-storage-"));

    public ExecutionEngine(EvaluationQueueRepository queueRepository,
                           PolicyRepository policyRepository,
                           PartitionCatalog catalog,
                           ExecutionLogRepository logRepository,
                           ActionExecutor actionExecutor,
                           ExecutionFailureClassifier failureClassifier,
                           PartitionLockRegistry lockRegistry,
                           EngineConfigService configService,
                           PartitionMergeScheduler mergeScheduler,
                           FailureAlertMonitor alertMonitor,
                           LifecycleMetrics metrics,
                           Clock clock) {
        this.queueRepository = queueRepository;
        this.policyRepository = policyRepository;
        this.catalog = catalog;
        this.logRepository = logRepository;
        this.actionExecutor = actionExecutor;
        this.failureClassifier = failureClassifier;
        this.lockRegistry = lockRegistry;
        this.configService = configService;
        this.mergeScheduler = mergeScheduler;
        this.alertMonitor = alertMonitor;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs one execution pass and waits for the actions it started.
     *
     * @param trigger   SCHEDULED passes also require auto-execution to be enabled
     * @param policyId  restrict to one policy, or null
     * @param datasetId restrict to one dataset, or null
     * @return counts of the pass, or the reason it did not start
     * @throws MetadataUnavailableException if the queue cannot be read
     */
    public ExecutionSummary executePending(ExecutionTrigger trigger, Long policyId, String datasetId) {
        if (!passLock.tryLock()) {
            log.info("Execution pass not started: {}", PASS_IN_PROGRESS);
            return ExecutionSummary.notStarted(PASS_IN_PROGRESS);
        }
        try {
            return runPass(trigger, policyId, datasetId);
        } finally {
            passLock.unlock();
        }
    }

    private ExecutionSummary runPass(ExecutionTrigger trigger, Long policyId, String datasetId) {
        EngineConfig config = configService.current();
        String blocked = blockedReason(config, trigger);
        if (blocked != null) {
            log.info("Execution pass not started: {}", blocked);
            return ExecutionSummary.notStarted(blocked);
        }

        long startTime = System.currentTimeMillis();
        int poolSize = config.getMaxConcurrentOperations();
        ExecutionSummary summary = new ExecutionSummary();
        ExecutorService workers = Executors.newFixedThreadPool(poolSize, namedThreads("strata-worker-"));
        Semaphore slots = new Semaphore(poolSize);
        log.info("Starting {} execution pass with {} workers", trigger, poolSize);

        try {
            int dispatched = 0;
            while (dispatched < config.getMaxOperationsPerPass()) {
                slots.acquire();
                // stop, window and auto flag are honoured between claims
                config = configService.current();
                blocked = blockedReason(config, trigger);
                if (blocked != null) {
                    slots.release();
                    log.info("No further claims in this pass: {}", blocked);
                    break;
                }
                Optional<Claim> claim = claimNext(config, policyId, datasetId, summary);
                if (claim.isEmpty()) {
                    slots.release();
                    break;
                }
                dispatched++;
                Claim claimed = claim.get();
                EngineConfig actionConfig = config;
                workers.execute(() -> {
                    try {
                        execute(claimed, actionConfig, trigger, summary);
                    } finally {
                        slots.release();
                    }
                });
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Execution pass interrupted, waiting for running actions");
        } finally {
            awaitWorkers(workers);
        }

        summary.setDurationMs(System.currentTimeMillis() - startTime);
        metrics.recordPass("execution", summary.getDurationMs());
        log.info("Execution pass completed in {} ms: {}", summary.getDurationMs(), summary);
        return summary;
    }

    String blockedReason(EngineConfig config, ExecutionTrigger trigger) {
        if (config.isStopRequested()) {
            return STOP_REQUESTED;
        }
        if (trigger == ExecutionTrigger.SCHEDULED && !config.isAutoExecutionEnabled()) {
            return AUTO_EXECUTION_DISABLED;
        }
        if (!config.getExecutionWindow().isOpen(LocalDateTime.now(clock))) {
            return "Outside execution window " + config.getExecutionWindow().describe();
        }
        return null;
    }

    private Optional<Claim> claimNext(EngineConfig config, Long policyId, String datasetId, ExecutionSummary summary) {
        List<EvaluationQueueEntry> candidates;
        try {
            candidates = queueRepository.findPending(
                config.getMaxOperationsPerPass() + config.getMaxConcurrentOperations(), policyId, datasetId);
        } catch (MetadataStoreException e) {
            throw new MetadataUnavailableException("Cannot read the evaluation queue", "evaluation_queue", e);
        }

        for (EvaluationQueueEntry candidate : candidates) {
            Optional<Policy> policy = policyRepository.findById(candidate.getPolicyId());
            String skipReason = skipReason(candidate, policy);
            if (skipReason != null) {
                if (queueRepository.markSkipped(candidate.getId(), skipReason)) {
                    log.info("Skipped queued {} for {}: {}", candidate.getPolicyName(), candidate.getPartitionKey(), skipReason);
                    summary.skipped();
                }
                continue;
            }

            String owner = "execution:" + candidate.getId();
            if (!lockRegistry.tryLock(candidate.getPartitionKey(), owner)) {
                log.debug("Partition {} is busy, leaving {} queued", candidate.getPartitionKey(), candidate.getId());
                continue;
            }
            if (!queueRepository.claim(candidate.getId())) {
                lockRegistry.unlock(candidate.getPartitionKey(), owner);
                log.debug("Queue entry {} was claimed elsewhere", candidate.getId());
                continue;
            }
            summary.claimed();
            return Optional.of(new Claim(candidate, policy.get(), owner));
        }
        return Optional.empty();
    }

    private static String skipReason(EvaluationQueueEntry candidate, Optional<Policy> policy) {
        if (policy.isEmpty()) {
            return "Policy no longer exists";
        }
        if (!policy.get().isEnabled()) {
            return "Policy is disabled";
        }
        if (policy.get().getVersion() != candidate.getPolicyVersion()) {
            return "Policy changed since evaluation (version " + candidate.getPolicyVersion()
                + " queued, " + policy.get().getVersion() + " current)";
        }
        return null;
    }

    void execute(Claim claim, EngineConfig config, ExecutionTrigger trigger, ExecutionSummary summary) {
        EvaluationQueueEntry entry = claim.entry;
        Policy policy = claim.policy;
        String partitionKey = entry.getPartitionKey();
        boolean releaseLock = true;
        ExecutionLogEntry logEntry = null;
        try {
            Optional<Partition> current = catalog.findPartition(entry.getDatasetId(), entry.getPartitionName());
            logEntry = logRepository.start(ExecutionLogEntry.builder()
                .policyId(policy.getId())
                .policyName(policy.getName())
                .datasetId(entry.getDatasetId())
                .partitionName(entry.getPartitionName())
                .action(policy.getAction())
                .trigger(trigger)
                .sizeBefore(current.map(Partition::getByteSize).orElse(null))
                .locationBefore(current.map(Partition::getLocation).orElse(null))
                .codecBefore(current.map(Partition::getCodec).orElse(null))
                .build());
            if (current.isEmpty()) {
                fail(entry, policy.getAction(), logEntry, FailureKind.TERMINAL, "PARTITION_NOT_FOUND",
                    "Partition " + partitionKey + " no longer exists", summary);
                return;
            }

            Partition before = current.get();
            log.info("Executing {} of policy {} on {}", policy.getAction(), policy.getName(), partitionKey);
            CompletableFuture<Partition> action =
                CompletableFuture.supplyAsync(() -> actionExecutor.execute(policy, before), storageExecutor);
            TimeLimiter timeLimiter = TimeLimiter.of("action-" + entry.getId(), TimeLimiterConfig.custom()
                .timeoutDuration(config.getActionTimeout())
                .cancelRunningFuture(false)
                .build());

            Partition after;
            try {
                after = timeLimiter.executeFutureSupplier(() -> action);
            } catch (TimeoutException e) {
                releaseLock = false;
                action.whenComplete((result, error) -> lateCompletion(claim, trigger, result, error));
                timedOut(entry, logEntry, config.getActionTimeout(), summary);
                return;
            }

            succeed(entry, logEntry, after, summary);
            if (policy.getAction() == ActionType.MOVE && after != null) {
                mergeScheduler.onMoveCompleted(policy, after, trigger, claim.owner);
            }
        } catch (Exception e) {
            FailureKind kind = failureClassifier.classify(e);
            Throwable cause = ExecutionFailureClassifier.unwrap(e);
            log.error("{} of policy {} on {} failed ({})", policy.getAction(), policy.getName(), partitionKey, kind, cause);
            fail(entry, policy.getAction(), logEntry, kind, failureClassifier.errorCode(e), cause.getMessage(), summary);
        } finally {
            if (releaseLock) {
                lockRegistry.unlock(partitionKey, claim.owner);
            }
        }
    }

    /**
     * Runs when a storage call returns after its action was already recorded as timed out.
     * A late MOVE still gets its merge, since the next evaluation sees the partition in its
     * target location and never queues it again.
     */
    void lateCompletion(Claim claim, ExecutionTrigger trigger, Partition result, Throwable error) {
        Policy policy = claim.policy;
        String partitionKey = claim.entry.getPartitionKey();
        try {
            if (error != null) {
                log.warn("Timed-out {} on {} has returned with error: {}", policy.getAction(), partitionKey,
                    ExecutionFailureClassifier.unwrap(error).getMessage());
                return;
            }
            log.warn("Timed-out {} on {} has returned successfully", policy.getAction(), partitionKey);
            if (policy.getAction() == ActionType.MOVE && result != null) {
                MergeOutcome outcome = mergeScheduler.onMoveCompleted(policy, result, trigger, claim.owner);
                log.info("Merge after late {} of {}: {}", policy.getAction(), partitionKey, outcome);
            }
        } finally {
            lockRegistry.unlock(partitionKey, claim.owner);
        }
    }

    private void succeed(EvaluationQueueEntry entry, ExecutionLogEntry logEntry, Partition after, ExecutionSummary summary) {
        logEntry.setStatus(ExecutionStatus.SUCCESS);
        logEntry.setSizeAfter(after != null ? after.getByteSize() : 0L);
        logEntry.setLocationAfter(after != null ? after.getLocation() : null);
        logEntry.setCodecAfter(after != null ? after.getCodec() : null);
        logRepository.complete(logEntry);
        queueRepository.complete(entry.getId(), QueueStatus.SUCCESS, null, logEntry.getId(),
            "Executed " + logEntry.getAction().getValue());
        metrics.recordActionSuccess(logEntry.getAction(), logEntry.getDurationMs() != null ? logEntry.getDurationMs() : 0L);
        summary.succeeded();
        log.info("{} on {} succeeded in {} ms, {} -> {} bytes", logEntry.getAction(), entry.getPartitionKey(),
            logEntry.getDurationMs(), logEntry.getSizeBefore(), logEntry.getSizeAfter());
    }

    private void timedOut(EvaluationQueueEntry entry, ExecutionLogEntry logEntry, Duration timeout, ExecutionSummary summary) {
        log.error("{} on {} exceeded the action timeout of {}, marking it FAILED while the storage call continues",
            logEntry.getAction(), entry.getPartitionKey(), timeout);
        summary.timedOut();
        fail(entry, logEntry.getAction(), logEntry, FailureKind.RETRYABLE, "TIMEOUT",
            "Action exceeded timeout of " + timeout + "; the storage operation may still be running", summary);
        metrics.recordActionTimeout(logEntry.getAction());
        alertMonitor.actionTimedOut(logEntry, timeout);
    }

    private void fail(EvaluationQueueEntry entry, ActionType action, ExecutionLogEntry logEntry, FailureKind kind,
                      String errorCode, String message, ExecutionSummary summary) {
        summary.failed();
        metrics.recordActionFailure(action, kind);
        try {
            Long executionId = null;
            if (logEntry != null) {
                logEntry.setStatus(ExecutionStatus.FAILED);
                logEntry.setErrorCode(errorCode);
                logEntry.setErrorMessage(message);
                logEntry.setFailureKind(kind);
                logRepository.complete(logEntry);
                executionId = logEntry.getId();
            }
            queueRepository.complete(entry.getId(), QueueStatus.FAILED, kind, executionId, message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of queue entry {} ({}); it stays RUNNING", entry.getId(),
                entry.getPartitionKey(), e);
        }
    }

    private static void awaitWorkers(ExecutorService workers) {
        workers.shutdown();
        try {
            while (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for running actions to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for running actions");
        }
    }

    @PreDestroy
    public void shutdown() {
        storageExecutor.shutdown();
        log.info("Execution engine stopped accepting storage calls");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    static final class Claim {
        final EvaluationQueueEntry entry;
        final Policy policy;
        final String owner;

        Claim(EvaluationQueueEntry entry, Policy policy, String owner) {
            this.entry = entry;
            this.policy = policy;
            this.owner = owner;
        }
    }
}
