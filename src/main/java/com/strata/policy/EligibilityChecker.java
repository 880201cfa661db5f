package com.strata.policy;

import com.strata.classifier.ClassificationResult;
import com.strata.classifier.PartitionAge;
import com.strata.classifier.TemperatureClassifier;
import com.strata.domain.Partition;
import com.strata.domain.PartitionTemperature;
import com.strata.domain.Policy;
import com.strata.domain.ThresholdProfile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a partition satisfies every configured condition of a policy.
 *
 * <p>Conditions are conjunctive and unset conditions are ignored. All conditions are
 * checked even after one fails, so the recorded reason names every one that did not hold.
 * A partition already in the state the action would produce is never eligible.
 */
@Component
public class EligibilityChecker {

    static final String UNPARSEABLE_BOUNDARY = "Partition boundary date could not be parsed";

    private final TemperatureClassifier classifier;
    private final CustomConditionEvaluator conditionEvaluator;
    private final Clock clock;

    public EligibilityChecker(TemperatureClassifier classifier, CustomConditionEvaluator conditionEvaluator, Clock clock) {
        this.classifier = classifier;
        this.conditionEvaluator = conditionEvaluator;
        this.clock = clock;
    }

    /**
     * @param profile  thresholds resolved for the policy
     * @param snapshot refreshed access snapshot of the partition, may be null
     */
    public EligibilityResult check(Policy policy, Partition partition, ThresholdProfile profile,
                                   PartitionTemperature snapshot, Instant now) {
        List<String> failed = new ArrayList<>();
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());

        alreadyInTargetState(policy, partition).ifPresent(failed::add);

        Optional<Long> ageDays = PartitionAge.days(partition, today);
        if (policy.getAgeDays() != null) {
            if (ageDays.isEmpty()) {
                failed.add(UNPARSEABLE_BOUNDARY);
            } else if (ageDays.get() < policy.getAgeDays()) {
                failed.add(String.format("Partition age %d days is below the required %d days",
                    ageDays.get(), policy.getAgeDays()));
            }
        }
        if (policy.getAgeMonths() != null) {
            Optional<Long> ageMonths = PartitionAge.months(partition, today);
            if (ageMonths.isEmpty()) {
                failed.add(UNPARSEABLE_BOUNDARY);
            } else if (ageMonths.get() < policy.getAgeMonths()) {
                failed.add(String.format("Partition age %d months is below the required %d months",
                    ageMonths.get(), policy.getAgeMonths()));
            }
        }

        if (policy.getTemperature() != null) {
            ClassificationResult classification = classifier.classify(partition, profile, snapshot, now);
            if (classification.getTemperature() != policy.getTemperature()) {
                failed.add(String.format("Partition temperature %s under profile %s does not match required %s",
                    classification.getTemperature(), profile.getName(), policy.getTemperature()));
            }
        }

        if (policy.getMinSizeBytes() != null && partition.getByteSize() < policy.getMinSizeBytes()) {
            failed.add(String.format("Partition size %d bytes is below the minimum %d bytes",
                partition.getByteSize(), policy.getMinSizeBytes()));
        }
        if (policy.getMaxSizeBytes() != null && partition.getByteSize() > policy.getMaxSizeBytes()) {
            failed.add(String.format("Partition size %d bytes is above the maximum %d bytes",
                partition.getByteSize(), policy.getMaxSizeBytes()));
        }

        String condition = policy.getCustomCondition();
        if (condition != null && !condition.isBlank()) {
            try {
                if (!conditionEvaluator.evaluate(condition, new PartitionAttributes(partition, ageDays.orElse(null)))) {
                    failed.add("Custom condition not satisfied: " + condition);
                }
            } catch (IllegalArgumentException e) {
                failed.add("Custom condition could not be evaluated: " + e.getMessage());
            }
        }

        return failed.isEmpty() ? EligibilityResult.eligible() : EligibilityResult.ineligible(failed);
    }

    private static Optional<String> alreadyInTargetState(Policy policy, Partition partition) {
        switch (policy.getAction()) {
            case COMPRESS:
                if (policy.getCodec() != null && policy.getCodec().equalsIgnoreCase(partition.getCodec())) {
                    return Optional.of("Partition already compressed with " + partition.getCodec());
                }
                return Optional.empty();
            case MOVE:
                if (policy.getLocation() != null && policy.getLocation().equals(partition.getLocation())) {
                    return Optional.of("Partition already in target location " + partition.getLocation());
                }
                return Optional.empty();
            case READ_ONLY:
                if (partition.isReadOnly()) {
                    return Optional.of("Partition already read-only");
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }
}
