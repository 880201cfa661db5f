package com.strata.execution;

import com.strata.domain.ActionType;
import com.strata.domain.Partition;
import com.strata.domain.Policy;
import com.strata.storage.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Translates a policy action into storage engine calls.
 */
@Component
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final StorageEngine storageEngine;

    public ActionExecutor(StorageEngine storageEngine) {
        this.storageEngine = storageEngine;
    }

    /**
     * Runs the policy's action against the partition, followed by the optional index
     * rebuild and statistics gathering.
     *
     * @return the partition as it is after the action, or null when it was dropped
     * @throws IllegalArgumentException when the policy lacks a parameter its action needs
     */
    public Partition execute(Policy policy, Partition partition) {
        ActionType action = policy.getAction();
        Partition result;
        switch (action) {
            case COMPRESS:
                result = storageEngine.setCodec(partition, require(policy.getCodec(), "codec", policy));
                break;
            case MOVE:
                result = storageEngine.relocate(partition,
                    require(policy.getLocation(), "location", policy),
                    require(policy.getCodec(), "codec", policy));
                break;
            case READ_ONLY:
                result = storageEngine.sealReadOnly(partition);
                break;
            case DROP:
                storageEngine.drop(partition);
                return null;
            case TRUNCATE:
                result = storageEngine.truncate(partition);
                break;
            case CUSTOM:
                result = storageEngine.executeCustom(partition, require(policy.getCustomAction(), "custom_action", policy));
                break;
            default:
                throw new IllegalArgumentException("Action " + action + " cannot be executed for policy " + policy.getName());
        }

        if (policy.isRebuildIndexes()) {
            log.debug("Rebuilding indexes of {}", result.getKey());
            storageEngine.rebuildIndexes(result);
        }
        if (policy.isGatherStats()) {
            log.debug("Gathering statistics of {}", result.getKey());
            storageEngine.gatherStatistics(result);
        }
        return result;
    }

    private static String require(String value, String field, Policy policy) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Policy " + policy.getName() + " has no " + field
                + " for action " + policy.getAction());
        }
        return value;
    }
}
