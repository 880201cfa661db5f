package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Result of matching one policy against one partition. There is one entry per
 * (policy, partition) pair; each evaluation pass upserts it.
 */
public class EvaluationQueueEntry {

    @JsonProperty("queue_id")
    private Long id;

    @JsonProperty("policy_id")
    private Long policyId;

    @JsonProperty("policy_name")
    private String policyName;

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("partition_name")
    private String partitionName;

    /**
     * Policy priority at evaluation time
     */
    @JsonProperty("priority")
    private int priority;

    /**
     * Parsed boundary date of the partition; older first within a priority, null sorts first
     */
    @JsonProperty("partition_boundary")
    private LocalDate partitionBoundary;

    @JsonProperty("eligible")
    private boolean eligible;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("status")
    private QueueStatus status;

    @JsonProperty("policy_version")
    private int policyVersion;

    @JsonProperty("failure_kind")
    private FailureKind failureKind;

    @JsonProperty("execution_id")
    private Long executionId;

    @JsonProperty("attempts")
    private int attempts;

    @JsonProperty("evaluated_at")
    private Instant evaluatedAt;

    @JsonProperty("claimed_at")
    private Instant claimedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    public EvaluationQueueEntry() {
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public String getPartitionKey() {
        return Partition.key(datasetId, partitionName);
    }

    public static class Builder {
        private final EvaluationQueueEntry entry = new EvaluationQueueEntry();

        public Builder id(Long id) {
            entry.id = id;
            return this;
        }

        public Builder policyId(Long policyId) {
            entry.policyId = policyId;
            return this;
        }

        public Builder policyName(String policyName) {
            entry.policyName = policyName;
            return this;
        }

        public Builder datasetId(String datasetId) {
            entry.datasetId = datasetId;
            return this;
        }

        public Builder partitionName(String partitionName) {
            entry.partitionName = partitionName;
            return this;
        }

        public Builder priority(int priority) {
            entry.priority = priority;
            return this;
        }

        public Builder partitionBoundary(LocalDate partitionBoundary) {
            entry.partitionBoundary = partitionBoundary;
            return this;
        }

        public Builder eligible(boolean eligible) {
            entry.eligible = eligible;
            return this;
        }

        public Builder reason(String reason) {
            entry.reason = reason;
            return this;
        }

        public Builder status(QueueStatus status) {
            entry.status = status;
            return this;
        }

        public Builder policyVersion(int policyVersion) {
            entry.policyVersion = policyVersion;
            return this;
        }

        public Builder failureKind(FailureKind failureKind) {
            entry.failureKind = failureKind;
            return this;
        }

        public Builder executionId(Long executionId) {
            entry.executionId = executionId;
            return this;
        }

        public Builder attempts(int attempts) {
            entry.attempts = attempts;
            return this;
        }

        public Builder evaluatedAt(Instant evaluatedAt) {
            entry.evaluatedAt = evaluatedAt;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            entry.claimedAt = claimedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            entry.completedAt = completedAt;
            return this;
        }

        public EvaluationQueueEntry build() {
            return entry;
        }
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getPolicyId() {
        return policyId;
    }

    public void setPolicyId(Long policyId) {
        this.policyId = policyId;
    }

    public String getPolicyName() {
        return policyName;
    }

    public void setPolicyName(String policyName) {
        this.policyName = policyName;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public void setDatasetId(String datasetId) {
        this.datasetId = datasetId;
    }

    public String getPartitionName() {
        return partitionName;
    }

    public void setPartitionName(String partitionName) {
        this.partitionName = partitionName;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public LocalDate getPartitionBoundary() {
        return partitionBoundary;
    }

    public void setPartitionBoundary(LocalDate partitionBoundary) {
        this.partitionBoundary = partitionBoundary;
    }

    public boolean isEligible() {
        return eligible;
    }

    public void setEligible(boolean eligible) {
        this.eligible = eligible;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public QueueStatus getStatus() {
        return status;
    }

    public void setStatus(QueueStatus status) {
        this.status = status;
    }

    public int getPolicyVersion() {
        return policyVersion;
    }

    public void setPolicyVersion(int policyVersion) {
        this.policyVersion = policyVersion;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public void setFailureKind(FailureKind failureKind) {
        this.failureKind = failureKind;
    }

    public Long getExecutionId() {
        return executionId;
    }

    public void setExecutionId(Long executionId) {
        this.executionId = executionId;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public void setEvaluatedAt(Instant evaluatedAt) {
        this.evaluatedAt = evaluatedAt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public void setClaimedAt(Instant claimedAt) {
        this.claimedAt = claimedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    @Override
    public String toString() {
        return "QueueEntry[" + id + " policy=" + policyId + " " + getPartitionKey() + " " + status + "]";
    }
}
