package com.strata.classifier;

import com.strata.domain.ClassificationMode;
import com.strata.domain.Partition;
import com.strata.domain.PartitionTemperature;
import com.strata.domain.Temperature;
import com.strata.domain.ThresholdProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Assigns HOT/WARM/COLD to partitions under a threshold profile.
 *
 * <p>Access signals from a refreshed snapshot take precedence when the snapshot is younger than
 * the staleness bound; otherwise the partition's boundary age decides. Both modes share the
 * step function of {@link Temperature#fromAge}. An unreadable boundary is classified COLD.
 */
@Component
public class TemperatureClassifier {

    private static final Logger log = LoggerFactory.getLogger(TemperatureClassifier.class);

    static final String UNPARSEABLE_WARNING = "Partition boundary date could not be parsed, classified as COLD";

    private final Duration accessStaleness;
    private final Clock clock;

    public TemperatureClassifier(@Value("${strata.classifier.access-staleness:PT24H}") Duration accessStaleness,
                                 Clock clock) {
        this.accessStaleness = accessStaleness;
        this.clock = clock;
    }

    public ClassificationResult classify(Partition partition, ThresholdProfile profile) {
        return classify(partition, profile, null, clock.instant());
    }

    /**
     * @param snapshot last refreshed access snapshot of the partition, may be null
     */
    public ClassificationResult classify(Partition partition, ThresholdProfile profile,
                                         PartitionTemperature snapshot, Instant now) {
        if (partition == null || profile == null) {
            throw new IllegalArgumentException("Partition and threshold profile must not be null");
        }
        if (snapshot != null && snapshot.hasAccessSignals()) {
            Duration age = snapshot.sinceRefresh(now);
            if (age != null && age.compareTo(accessStaleness) <= 0) {
                long idleDays = Math.max(0L, Duration.between(snapshot.lastAccess(), now).toDays());
                return new ClassificationResult(Temperature.fromAge(idleDays, profile), idleDays,
                    ClassificationMode.ACCESS, null);
            }
            log.debug("Access signals of {} are {} old, falling back to boundary age", partition.getKey(), age);
        }

        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        Optional<Long> ageDays = PartitionAge.days(partition, today);
        if (ageDays.isEmpty()) {
            log.warn("Cannot parse upper boundary '{}' of partition {}, classifying as COLD",
                partition.getUpperBound(), partition.getKey());
            return new ClassificationResult(Temperature.COLD, null, ClassificationMode.UNPARSEABLE_BOUNDARY,
                UNPARSEABLE_WARNING);
        }
        return new ClassificationResult(Temperature.fromAge(ageDays.get(), profile), ageDays.get(),
            ClassificationMode.AGE, null);
    }

    public Duration getAccessStaleness() {
        return accessStaleness;
    }
}
