package com.toolgraph.engine.tool;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * A named computation that reads run state and returns a partial state update.
 *
 * Tools receive a read-only copy of the run state and must not try to change
 * it; every effect flows through the returned map, which the engine merges
 * into the run. The two implementations are {@link ImmediateTool} and
 * {@link SuspendingTool}.
 */
public interface Tool {

    ToolMode mode();

    /**
     * Start the tool.
     *
     * @param state unmodifiable deep copy of the current run state
     * @return stage completing with the keys to merge into the run state;
     *         completing exceptionally (or throwing) fails the step
     */
    CompletionStage<Map<String, Object>> run(Map<String, Object> state);
}
