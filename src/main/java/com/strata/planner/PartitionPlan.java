package com.strata.planner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.domain.Granularity;
import com.strata.domain.PartitionSpec;
import com.strata.domain.StorageTier;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered, contiguous partition layout for one dataset.
 */
public class PartitionPlan {

    @JsonProperty("dataset_id")
    private final String datasetId;

    @JsonProperty("template")
    private final String templateName;

    @JsonProperty("range")
    private final DateRange range;

    @JsonProperty("reference_date")
    private final LocalDate referenceDate;

    @JsonProperty("partitions")
    private final List<PartitionSpec> partitions;

    @JsonProperty("auto_extension")
    private final AutoExtension autoExtension;

    public PartitionPlan(String datasetId, String templateName, DateRange range, LocalDate referenceDate,
                         List<PartitionSpec> partitions, AutoExtension autoExtension) {
        this.datasetId = datasetId;
        this.templateName = templateName;
        this.range = range;
        this.referenceDate = referenceDate;
        this.partitions = Collections.unmodifiableList(partitions);
        this.autoExtension = autoExtension;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public String getTemplateName() {
        return templateName;
    }

    public DateRange getRange() {
        return range;
    }

    public LocalDate getReferenceDate() {
        return referenceDate;
    }

    public List<PartitionSpec> getPartitions() {
        return partitions;
    }

    public AutoExtension getAutoExtension() {
        return autoExtension;
    }

    @JsonProperty("counts")
    public Map<StorageTier, Integer> getCountsByTier() {
        Map<StorageTier, Integer> counts = new EnumMap<>(StorageTier.class);
        for (StorageTier tier : StorageTier.values()) {
            counts.put(tier, 0);
        }
        for (PartitionSpec spec : partitions) {
            counts.merge(spec.getTier(), 1, Integer::sum);
        }
        return counts;
    }

    @JsonProperty("past_cold_horizon")
    public long getPastColdHorizonCount() {
        return partitions.stream().filter(PartitionSpec::isPastColdHorizon).count();
    }

    public List<PartitionSpec> partitionsIn(StorageTier tier) {
        return partitions.stream().filter(spec -> spec.getTier() == tier).collect(Collectors.toList());
    }

    /**
     * Interval the storage engine keeps extending after the last planned HOT boundary.
     */
    public static class AutoExtension {

        @JsonProperty("starting_at")
        private final LocalDate startingAt;

        @JsonProperty("granularity")
        private final Granularity granularity;

        @JsonProperty("location")
        private final String location;

        @JsonProperty("codec")
        private final String codec;

        public AutoExtension(LocalDate startingAt, Granularity granularity, String location, String codec) {
            this.startingAt = startingAt;
            this.granularity = granularity;
            this.location = location;
            this.codec = codec;
        }

        public LocalDate getStartingAt() {
            return startingAt;
        }

        public Granularity getGranularity() {
            return granularity;
        }

        public String getLocation() {
            return location;
        }

        public String getCodec() {
            return codec;
        }
    }
}
