package com.strata.policy;

import java.util.Optional;

/**
 * Evaluates a policy's custom condition against one partition.
 */
public interface CustomConditionEvaluator {

    /**
     * @return a description of why the expression is unusable, empty when it is valid
     */
    Optional<String> check(String expression);

    /**
     * @throws IllegalArgumentException if the expression cannot be parsed or evaluated
     */
    boolean evaluate(String expression, PartitionAttributes attributes);
}
