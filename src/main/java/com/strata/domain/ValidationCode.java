package com.strata.domain;

/**
 * Defect kinds reported when a policy, threshold profile or dataset is written.
 */
public enum ValidationCode {
    NAME_REQUIRED,
    ID_REQUIRED,
    NAME_NOT_UNIQUE,
    DATASET_REQUIRED,
    DATASET_NOT_FOUND,
    ACTION_REQUIRED,
    ACTION_NOT_ALLOWED,
    PRIORITY_OUT_OF_RANGE,
    NO_TRIGGER_CONDITION,
    AGE_NEGATIVE,
    SIZE_NEGATIVE,
    SIZE_RANGE_INVALID,
    CUSTOM_CONDITION_INVALID,
    CODEC_REQUIRED,
    LOCATION_REQUIRED,
    DESTINATION_TIER_REQUIRED,
    CUSTOM_ACTION_REQUIRED,
    TIER_MISMATCH,
    PROFILE_NOT_FOUND,
    TEMPLATE_NOT_FOUND,
    PROFILE_IN_USE,
    THRESHOLD_NOT_POSITIVE,
    THRESHOLDS_NOT_ASCENDING
}
