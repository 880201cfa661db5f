package com.strata.execution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Snapshot of the operator-controlled scheduling state. Immutable: changes produce a new
 * value, and each loop iteration reads the snapshot current at that moment.
 */
public final class EngineConfig {

    public static final int MAX_CONCURRENCY_LIMIT = 64;

    private final boolean autoExecutionEnabled;
    private final ExecutionWindow executionWindow;
    private final int maxConcurrentOperations;
    private final int maxOperationsPerPass;
    private final Duration actionTimeout;
    private final Duration minReevaluationInterval;
    private final Duration failedRetryDelay;
    private final boolean stopRequested;

    private EngineConfig(Builder builder) {
        this.autoExecutionEnabled = builder.autoExecutionEnabled;
        this.executionWindow = builder.executionWindow;
        this.maxConcurrentOperations = builder.maxConcurrentOperations;
        this.maxOperationsPerPass = builder.maxOperationsPerPass;
        this.actionTimeout = builder.actionTimeout;
        this.minReevaluationInterval = builder.minReevaluationInterval;
        this.failedRetryDelay = builder.failedRetryDelay;
        this.stopRequested = builder.stopRequested;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .autoExecutionEnabled(autoExecutionEnabled)
            .executionWindow(executionWindow)
            .maxConcurrentOperations(maxConcurrentOperations)
            .maxOperationsPerPass(maxOperationsPerPass)
            .actionTimeout(actionTimeout)
            .minReevaluationInterval(minReevaluationInterval)
            .failedRetryDelay(failedRetryDelay)
            .stopRequested(stopRequested);
    }

    @JsonProperty("auto_execution_enabled")
    public boolean isAutoExecutionEnabled() {
        return autoExecutionEnabled;
    }

    @JsonIgnore
    public ExecutionWindow getExecutionWindow() {
        return executionWindow;
    }

    @JsonProperty("execution_window")
    public String getExecutionWindowDescription() {
        return executionWindow.describe();
    }

    @JsonProperty("max_concurrent_operations")
    public int getMaxConcurrentOperations() {
        return maxConcurrentOperations;
    }

    @JsonProperty("max_operations_per_pass")
    public int getMaxOperationsPerPass() {
        return maxOperationsPerPass;
    }

    @JsonProperty("action_timeout")
    public Duration getActionTimeout() {
        return actionTimeout;
    }

    @JsonProperty("min_reevaluation_interval")
    public Duration getMinReevaluationInterval() {
        return minReevaluationInterval;
    }

    @JsonProperty("failed_retry_delay")
    public Duration getFailedRetryDelay() {
        return failedRetryDelay;
    }

    @JsonProperty("stop_requested")
    public boolean isStopRequested() {
        return stopRequested;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
            "autoExecution=" + autoExecutionEnabled +
            ", window=" + executionWindow +
            ", maxConcurrent=" + maxConcurrentOperations +
            ", maxPerPass=" + maxOperationsPerPass +
            ", actionTimeout=" + actionTimeout +
            ", stopRequested=" + stopRequested +
            '}';
    }

    public static class Builder {
        private boolean autoExecutionEnabled = true;
        private ExecutionWindow executionWindow = ExecutionWindow.always();
        private int maxConcurrentOperations = 4;
        private int maxOperationsPerPass = 10;
        private Duration actionTimeout = Duration.ofHours(4);
        private Duration minReevaluationInterval = Duration.ofDays(1);
        private Duration failedRetryDelay = Duration.ZERO;
        private boolean stopRequested;

        public Builder autoExecutionEnabled(boolean autoExecutionEnabled) {
            this.autoExecutionEnabled = autoExecutionEnabled;
            return this;
        }

        public Builder executionWindow(ExecutionWindow executionWindow) {
            this.executionWindow = executionWindow;
            return this;
        }

        public Builder maxConcurrentOperations(int maxConcurrentOperations) {
            this.maxConcurrentOperations = maxConcurrentOperations;
            return this;
        }

        public Builder maxOperationsPerPass(int maxOperationsPerPass) {
            this.maxOperationsPerPass = maxOperationsPerPass;
            return this;
        }

        public Builder actionTimeout(Duration actionTimeout) {
            this.actionTimeout = actionTimeout;
            return this;
        }

        public Builder minReevaluationInterval(Duration minReevaluationInterval) {
            this.minReevaluationInterval = minReevaluationInterval;
            return this;
        }

        public Builder failedRetryDelay(Duration failedRetryDelay) {
            this.failedRetryDelay = failedRetryDelay;
            return this;
        }

        public Builder stopRequested(boolean stopRequested) {
            this.stopRequested = stopRequested;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a limit or duration is out of range
         */
        public EngineConfig build() {
            if (executionWindow == null) {
                throw new IllegalArgumentException("Execution window must not be null");
            }
            if (maxConcurrentOperations < 1 || maxConcurrentOperations > MAX_CONCURRENCY_LIMIT) {
                throw new IllegalArgumentException("Max concurrent operations must be between 1 and "
                    + MAX_CONCURRENCY_LIMIT + ", got " + maxConcurrentOperations);
            }
            if (maxOperationsPerPass < 1) {
                throw new IllegalArgumentException("Max operations per pass must be positive, got " + maxOperationsPerPass);
            }
            requirePositive("Action timeout", actionTimeout);
            requireNotNegative("Minimum re-evaluation interval", minReevaluationInterval);
            requireNotNegative("Failed retry delay", failedRetryDelay);
            return new EngineConfig(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }

        private static void requireNotNegative(String name, Duration value) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative, got " + value);
            }
        }
    }
}
