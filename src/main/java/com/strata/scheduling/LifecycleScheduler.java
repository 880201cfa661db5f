package com.strata.scheduling;

import com.strata.classifier.TemperatureRefreshService;
import com.strata.domain.ExecutionTrigger;
import com.strata.execution.ExecutionEngine;
import com.strata.execution.ExecutionSummary;
import com.strata.merge.PartitionMergeScheduler;
import com.strata.monitoring.FailureAlertMonitor;
import com.strata.policy.EvaluationSummary;
import com.strata.policy.MetadataUnavailableException;
import com.strata.policy.PolicyEvaluationEngine;
import com.strata.storage.ExecutionLogRepository;
import com.strata.storage.MetadataStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic loops of the lifecycle engine.
 *
 * Each loop works on its own inputs. A failure of one unit of work is handled inside the
 * loop; only an unreadable metadata store stops a pass, and that raises an alert.
 */
@Component
@ConditionalOnProperty(name = "strata.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class LifecycleScheduler {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleScheduler.class);

    private final TemperatureRefreshService refreshService;
    private final PolicyEvaluationEngine evaluationEngine;
    private final ExecutionEngine executionEngine;
    private final PartitionMergeScheduler mergeScheduler;
    private final ExecutionLogRepository logRepository;
    private final FailureAlertMonitor alertMonitor;
    private final Clock clock;
    private final Duration logRetention;

    public LifecycleScheduler(TemperatureRefreshService refreshService,
                              PolicyEvaluationEngine evaluationEngine,
                              ExecutionEngine executionEngine,
                              PartitionMergeScheduler mergeScheduler,
                              ExecutionLogRepository logRepository,
                              FailureAlertMonitor alertMonitor,
                              Clock clock,
                              @Value("${strata.log.retention:P365D}") Duration logRetention) {
        this.refreshService = refreshService;
        this.evaluationEngine = evaluationEngine;
        this.executionEngine = executionEngine;
        this.mergeScheduler = mergeScheduler;
        this.logRepository = logRepository;
        this.alertMonitor = alertMonitor;
        this.clock = clock;
        this.logRetention = logRetention;
    }

    @Scheduled(cron = "${strata.scheduling.refresh-cron:0 0 1 * * *}")
    public void refreshTemperatures() {
        logger.info("Starting scheduled temperature refresh");
        try {
            refreshService.refreshAll();
        } catch (MetadataUnavailableException e) {
            metadataUnavailable("temperature-refresh", e);
        } catch (Exception e) {
            logger.error("Scheduled temperature refresh failed", e);
        }
    }

    @Scheduled(cron = "${strata.scheduling.evaluation-cron:0 30 1 * * *}")
    public void evaluatePolicies() {
        logger.info("Starting scheduled policy evaluation");
        try {
            EvaluationSummary summary = evaluationEngine.evaluateAll();
            logger.debug("Scheduled evaluation result: {}", summary);
        } catch (MetadataUnavailableException e) {
            metadataUnavailable("evaluation", e);
        } catch (Exception e) {
            logger.error("Scheduled policy evaluation failed", e);
        }
    }

    /**
     * Runs often; the engine itself decides whether the window is open.
     */
    @Scheduled(fixedDelayString = "${strata.scheduling.execution-delay:PT15M}",
        initialDelayString = "${strata.scheduling.execution-initial-delay:PT1M}")
    public void executePending() {
        try {
            ExecutionSummary summary = executionEngine.executePending(ExecutionTrigger.SCHEDULED, null, null);
            if (!summary.isStarted()) {
                logger.debug("Scheduled execution skipped: {}", summary.getNotStartedReason());
            }
        } catch (MetadataUnavailableException e) {
            metadataUnavailable("execution", e);
        } catch (Exception e) {
            logger.error("Scheduled execution pass failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${strata.scheduling.merge-delay:PT1H}",
        initialDelayString = "${strata.scheduling.merge-initial-delay:PT5M}")
    public void retryDeferredMerges() {
        try {
            mergeScheduler.retryBacklog();
        } catch (MetadataStoreException e) {
            metadataUnavailable("merge", new MetadataUnavailableException("Cannot read merge backlog", "merge_backlog", e));
        } catch (Exception e) {
            logger.error("Scheduled merge backlog retry failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${strata.scheduling.alert-check-delay:PT5M}")
    public void checkFailureRate() {
        try {
            alertMonitor.checkFailureRate();
        } catch (Exception e) {
            logger.error("Failure rate check failed", e);
        }
    }

    @Scheduled(cron = "${strata.scheduling.maintenance-cron:0 0 4 * * *}")
    public void purgeExecutionLog() {
        logger.info("Starting execution log maintenance");
        long startTime = System.currentTimeMillis();
        try {
            Instant cutoff = clock.instant().minus(logRetention);
            int deleted = logRepository.deleteCompletedBefore(cutoff);
            logger.info("Execution log maintenance completed in {} ms: {} entries older than {} removed",
                System.currentTimeMillis() - startTime, deleted, cutoff);
        } catch (Exception e) {
            logger.error("Execution log maintenance failed", e);
        }
    }

    private void metadataUnavailable(String loop, MetadataUnavailableException e) {
        logger.error("{} pass aborted, metadata store unavailable", loop, e);
        alertMonitor.metadataUnavailable(loop, e);
    }
}
