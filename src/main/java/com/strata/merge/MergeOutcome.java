package com.strata.merge;

public enum MergeOutcome {

    /**
     * The fine partition was absorbed by its coarse neighbour
     */
    MERGED,

    /**
     * The partition starts its coarse period and becomes the merge target for it
     */
    SEED,

    /**
     * The destination tier is not coarser than the partition, or no template applies
     */
    NOT_APPLICABLE,

    /**
     * A precondition does not hold yet; persisted for a later attempt
     */
    DEFERRED,

    /**
     * The storage engine rejected the merge; persisted for a later attempt
     */
    FAILED
}
