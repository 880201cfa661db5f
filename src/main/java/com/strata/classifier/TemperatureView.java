package com.strata.classifier;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.domain.ClassificationMode;
import com.strata.domain.PartitionTemperature;
import com.strata.domain.Temperature;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored temperature of a partition as shown to operators.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TemperatureView {

    @JsonProperty("partition_name")
    private final String partitionName;

    @JsonProperty("temperature")
    private final Temperature temperature;

    @JsonProperty("age_days")
    private final Long ageDays;

    @JsonProperty("mode")
    private final ClassificationMode mode;

    @JsonProperty("last_read_at")
    private final Instant lastReadAt;

    @JsonProperty("last_write_at")
    private final Instant lastWriteAt;

    @JsonProperty("minutes_since_refresh")
    private final Long minutesSinceRefresh;

    @JsonProperty("recommendation")
    private final String recommendation;

    @JsonProperty("warning")
    private final String warning;

    public TemperatureView(PartitionTemperature snapshot, Instant now) {
        this.partitionName = snapshot.getPartitionName();
        this.temperature = snapshot.getTemperature();
        this.ageDays = snapshot.getAgeDays();
        this.mode = snapshot.getMode();
        this.lastReadAt = snapshot.getLastReadAt();
        this.lastWriteAt = snapshot.getLastWriteAt();
        Duration sinceRefresh = snapshot.sinceRefresh(now);
        this.minutesSinceRefresh = sinceRefresh != null ? sinceRefresh.toMinutes() : null;
        this.recommendation = snapshot.recommendation();
        this.warning = snapshot.getWarning();
    }

    public String getPartitionName() {
        return partitionName;
    }

    public Temperature getTemperature() {
        return temperature;
    }

    public Long getAgeDays() {
        return ageDays;
    }

    public ClassificationMode getMode() {
        return mode;
    }

    public Instant getLastReadAt() {
        return lastReadAt;
    }

    public Instant getLastWriteAt() {
        return lastWriteAt;
    }

    public Long getMinutesSinceRefresh() {
        return minutesSinceRefresh;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public String getWarning() {
        return warning;
    }
}
