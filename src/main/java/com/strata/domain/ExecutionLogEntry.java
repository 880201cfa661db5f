package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit record of one attempted action. Written in RUNNING state before the storage
 * call and completed exactly once; never changed afterwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionLogEntry {

    @JsonProperty("execution_id")
    private Long id;

    /**
     * Null for merges retried from the backlog
     */
    @JsonProperty("policy_id")
    private Long policyId;

    @JsonProperty("policy_name")
    private String policyName;

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("partition_name")
    private String partitionName;

    @JsonProperty("action")
    private ActionType action;

    @JsonProperty("status")
    private ExecutionStatus status;

    @JsonProperty("trigger")
    private ExecutionTrigger trigger;

    @JsonProperty("size_before")
    private Long sizeBefore;

    @JsonProperty("size_after")
    private Long sizeAfter;

    @JsonProperty("location_before")
    private String locationBefore;

    @JsonProperty("location_after")
    private String locationAfter;

    @JsonProperty("codec_before")
    private String codecBefore;

    @JsonProperty("codec_after")
    private String codecAfter;

    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("failure_kind")
    private FailureKind failureKind;

    @JsonProperty("detail")
    private String detail;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("ended_at")
    private Instant endedAt;

    @JsonProperty("duration_ms")
    private Long durationMs;

    public ExecutionLogEntry() {
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("space_saved")
    public Long getSpaceSaved() {
        if (sizeBefore == null || sizeAfter == null) {
            return null;
        }
        return sizeBefore - sizeAfter;
    }

    @JsonProperty("compression_ratio")
    public Double getCompressionRatio() {
        if (sizeBefore == null || sizeAfter == null || sizeAfter == 0) {
            return null;
        }
        return Math.round((double) sizeBefore / sizeAfter * 100.0) / 100.0;
    }

    public static class Builder {
        private final ExecutionLogEntry entry = new ExecutionLogEntry();

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

        public Builder action(ActionType action) {
            entry.action = action;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            entry.status = status;
            return this;
        }

        public Builder trigger(ExecutionTrigger trigger) {
            entry.trigger = trigger;
            return this;
        }

        public Builder sizeBefore(Long sizeBefore) {
            entry.sizeBefore = sizeBefore;
            return this;
        }

        public Builder sizeAfter(Long sizeAfter) {
            entry.sizeAfter = sizeAfter;
            return this;
        }

        public Builder locationBefore(String locationBefore) {
            entry.locationBefore = locationBefore;
            return this;
        }

        public Builder locationAfter(String locationAfter) {
            entry.locationAfter = locationAfter;
            return this;
        }

        public Builder codecBefore(String codecBefore) {
            entry.codecBefore = codecBefore;
            return this;
        }

        public Builder codecAfter(String codecAfter) {
            entry.codecAfter = codecAfter;
            return this;
        }

        public Builder errorCode(String errorCode) {
            entry.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            entry.errorMessage = errorMessage;
            return this;
        }

        public Builder failureKind(FailureKind failureKind) {
            entry.failureKind = failureKind;
            return this;
        }

        public Builder detail(String detail) {
            entry.detail = detail;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            entry.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            entry.endedAt = endedAt;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            entry.durationMs = durationMs;
            return this;
        }

        public ExecutionLogEntry build() {
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

    public ActionType getAction() {
        return action;
    }

    public void setAction(ActionType action) {
        this.action = action;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public ExecutionTrigger getTrigger() {
        return trigger;
    }

    public void setTrigger(ExecutionTrigger trigger) {
        this.trigger = trigger;
    }

    public Long getSizeBefore() {
        return sizeBefore;
    }

    public void setSizeBefore(Long sizeBefore) {
        this.sizeBefore = sizeBefore;
    }

    public Long getSizeAfter() {
        return sizeAfter;
    }

    public void setSizeAfter(Long sizeAfter) {
        this.sizeAfter = sizeAfter;
    }

    public String getLocationBefore() {
        return locationBefore;
    }

    public void setLocationBefore(String locationBefore) {
        this.locationBefore = locationBefore;
    }

    public String getLocationAfter() {
        return locationAfter;
    }

    public void setLocationAfter(String locationAfter) {
        this.locationAfter = locationAfter;
    }

    public String getCodecBefore() {
        return codecBefore;
    }

    public void setCodecBefore(String codecBefore) {
        this.codecBefore = codecBefore;
    }

    public String getCodecAfter() {
        return codecAfter;
    }

    public void setCodecAfter(String codecAfter) {
        this.codecAfter = codecAfter;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public void setFailureKind(FailureKind failureKind) {
        this.failureKind = failureKind;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }
}
