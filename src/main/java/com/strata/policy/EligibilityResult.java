package com.strata.policy;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of matching one policy against one partition. Ineligible results carry one
 * reason per failed condition.
 */
public class EligibilityResult {

    static final String ELIGIBLE_REASON = "Partition meets all policy criteria";

    private final List<String> failedConditions;

    private EligibilityResult(List<String> failedConditions) {
        this.failedConditions = Collections.unmodifiableList(failedConditions);
    }

    public static EligibilityResult eligible() {
        return new EligibilityResult(List.of());
    }

    public static EligibilityResult ineligible(List<String> failedConditions) {
        if (failedConditions == null || failedConditions.isEmpty()) {
            throw new IllegalArgumentException("An ineligible result needs at least one reason");
        }
        return new EligibilityResult(failedConditions);
    }

    public boolean isEligible() {
        return failedConditions.isEmpty();
    }

    public List<String> getFailedConditions() {
        return failedConditions;
    }

    public String getReason() {
        return isEligible() ? ELIGIBLE_REASON : String.join("; ", failedConditions);
    }

    @Override
    public String toString() {
        return (isEligible() ? "ELIGIBLE" : "INELIGIBLE") + ": " + getReason();
    }
}
