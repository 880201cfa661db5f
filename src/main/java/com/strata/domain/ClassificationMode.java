package com.strata.domain;

/**
 * Signal a temperature was derived from.
 */
public enum ClassificationMode {

    /**
     * Days since the partition's boundary date
     */
    AGE,

    /**
     * Days since the last observed read or write
     */
    ACCESS,

    /**
     * Boundary date could not be read; classified COLD
     */
    UNPARSEABLE_BOUNDARY
}
