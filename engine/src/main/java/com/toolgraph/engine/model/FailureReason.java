package com.toolgraph.engine.model;

/**
 * Why a run ended FAILED. Recorded on the run instead of being thrown,
 * so callers always get a RunState back for in-run problems.
 */
public enum FailureReason {
    NODE_MISSING,         // current node id does not exist in the graph
    STEP_LIMIT_EXCEEDED,  // maxSteps node executions without reaching an exit
    TOOL_FAILED,          // tool lookup, invocation or result validation failed
    INTERNAL_ERROR        // the engine itself threw while advancing the run
}
