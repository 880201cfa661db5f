package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle actions applied to a partition.
 */
public enum ActionType {

    /**
     * Recompress in place with a new codec
     */
    COMPRESS("compress", true),

    /**
     * Relocate to another storage location and recompress
     */
    MOVE("move", true),

    /**
     * Seal against further writes
     */
    READ_ONLY("read_only", true),

    /**
     * Remove the partition and its data
     */
    DROP("drop", true),

    /**
     * Remove the data, keep the partition
     */
    TRUNCATE("truncate", true),

    /**
     * Operator-supplied action block, run by the storage engine
     */
    CUSTOM("custom", true),

    /**
     * Consolidation of a fine partition into its coarse neighbour. Issued by the
     * merge scheduler only, never configurable on a policy.
     */
    MERGE("merge", false);

    private final String value;
    private final boolean policyAction;

    ActionType(String value, boolean policyAction) {
        this.value = value;
        this.policyAction = policyAction;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isPolicyAction() {
        return policyAction;
    }

    @JsonCreator
    public static ActionType fromValue(String value) {
        for (ActionType type : ActionType.values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ActionType value: " + value);
    }

    /**
     * Whether the action removes data irreversibly.
     */
    public boolean isDestructive() {
        return this == DROP || this == TRUNCATE;
    }
}
