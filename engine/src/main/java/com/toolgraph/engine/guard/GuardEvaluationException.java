package com.toolgraph.engine.guard;

/**
 * A well-formed guard could not be evaluated against the current state
 * (missing key, type mismatch, division by zero). ConditionEvaluator treats
 * the edge as not matching.
 */
public class GuardEvaluationException extends RuntimeException {

    public GuardEvaluationException(String message) {
        super(message);
    }
}
