package com.strata.monitoring;

import com.strata.domain.ActionType;
import com.strata.domain.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for the lifecycle loops.
 *
 * Tracks:
 * - Evaluation outcomes (queued, skipped, left unchanged, errors)
 * - Action outcomes per action type, and action duration
 * - Merges performed and deferred
 * - Alerts raised
 * - Duration of each loop pass
 */
@Component
public class LifecycleMetrics {

    private static final String ACTIONS = "strata.execution.actions";

    private final MeterRegistry registry;
    private final Counter partitionsQueued;
    private final Counter partitionsSkipped;
    private final Counter partitionsUnchanged;
    private final Counter evaluationErrors;
    private final Counter mergesCompleted;
    private final Counter mergesDeferred;
    private final Counter temperaturesRefreshed;

    public LifecycleMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.partitionsQueued = Counter.builder("strata.evaluation.partitions")
            .description("Policy/partition pairs found eligible and queued")
            .tag("outcome", "queued")
            .register(registry);

        this.partitionsSkipped = Counter.builder("strata.evaluation.partitions")
            .description("Policy/partition pairs recorded as skipped")
            .tag("outcome", "skipped")
            .register(registry);

        this.partitionsUnchanged = Counter.builder("strata.evaluation.partitions")
            .description("Pairs left as they were (running, blocked or recently executed)")
            .tag("outcome", "unchanged")
            .register(registry);

        this.evaluationErrors = Counter.builder("strata.evaluation.errors")
            .description("Policies or partitions that could not be evaluated")
            .register(registry);

        this.mergesCompleted = Counter.builder("strata.merge.operations")
            .description("Fine partitions merged into their coarse period")
            .tag("outcome", "merged")
            .register(registry);

        this.mergesDeferred = Counter.builder("strata.merge.operations")
            .description("Merges deferred to the backlog")
            .tag("outcome", "deferred")
            .register(registry);

        this.temperaturesRefreshed = Counter.builder("strata.classifier.refreshed")
            .description("Partition temperature snapshots written")
            .register(registry);
    }

    public void recordQueued(int count) {
        partitionsQueued.increment(count);
    }

    public void recordSkipped(int count) {
        partitionsSkipped.increment(count);
    }

    public void recordUnchanged(int count) {
        partitionsUnchanged.increment(count);
    }

    public void recordEvaluationErrors(int count) {
        evaluationErrors.increment(count);
    }

    public void recordActionSuccess(ActionType action, long durationMs) {
        actionCounter(action, "success").increment();
        Timer.builder("strata.execution.action.duration")
            .description("Duration of storage actions")
            .tag("action", action.name())
            .register(registry)
            .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordActionFailure(ActionType action, FailureKind kind) {
        actionCounter(action, kind == FailureKind.TERMINAL ? "failed_terminal" : "failed_retryable").increment();
    }

    public void recordActionTimeout(ActionType action) {
        actionCounter(action, "timeout").increment();
    }

    public void recordMerge() {
        mergesCompleted.increment();
    }

    public void recordMergeDeferred() {
        mergesDeferred.increment();
    }

    public void recordTemperaturesRefreshed(int count) {
        temperaturesRefreshed.increment(count);
    }

    public void recordAlert(String alertType) {
        Counter.builder("strata.alerts")
            .description("Operator alerts raised")
            .tag("type", alertType)
            .register(registry)
            .increment();
    }

    /**
     * Record the duration of one pass of a loop ("evaluation", "execution", "merge", ...).
     */
    public void recordPass(String loop, long durationMs) {
        Timer.builder("strata.loop.duration")
            .description("Duration of one pass of a lifecycle loop")
            .tag("loop", loop)
            .register(registry)
            .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private Counter actionCounter(ActionType action, String outcome) {
        return Counter.builder(ACTIONS)
            .description("Storage actions by type and outcome")
            .tag("action", action.name())
            .tag("outcome", outcome)
            .register(registry);
    }
}
