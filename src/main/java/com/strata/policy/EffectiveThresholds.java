package com.strata.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.domain.ThresholdProfile;

/**
 * The thresholds a policy is actually evaluated with.
 */
public class EffectiveThresholds {

    public enum Source {
        POLICY_PROFILE,
        GLOBAL_DEFAULT
    }

    @JsonProperty("policy_id")
    private final Long policyId;

    @JsonProperty("policy_name")
    private final String policyName;

    @JsonProperty("profile_name")
    private final String profileName;

    @JsonProperty("hot_days")
    private final int hotDays;

    @JsonProperty("warm_days")
    private final int warmDays;

    @JsonProperty("cold_days")
    private final int coldDays;

    @JsonProperty("source")
    private final Source source;

    public EffectiveThresholds(Long policyId, String policyName, ThresholdProfile profile, Source source) {
        this.policyId = policyId;
        this.policyName = policyName;
        this.profileName = profile.getName();
        this.hotDays = profile.getHotDays();
        this.warmDays = profile.getWarmDays();
        this.coldDays = profile.getColdDays();
        this.source = source;
    }

    public Long getPolicyId() {
        return policyId;
    }

    public String getPolicyName() {
        return policyName;
    }

    public String getProfileName() {
        return profileName;
    }

    public int getHotDays() {
        return hotDays;
    }

    public int getWarmDays() {
        return warmDays;
    }

    public int getColdDays() {
        return coldDays;
    }

    public Source getSource() {
        return source;
    }
}
