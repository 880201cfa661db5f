package com.strata.planner;

/**
 * Tier template defects. Each is reported per tier.
 */
public enum TemplateErrorCode {
    TEMPLATE_NAME_MISSING,
    TIER_MISSING,
    AGE_THRESHOLD_MISSING,
    AGE_THRESHOLD_NOT_POSITIVE,
    GRANULARITY_MISSING,
    LOCATION_MISSING,
    CODEC_MISSING,
    THRESHOLDS_NOT_ASCENDING
}
