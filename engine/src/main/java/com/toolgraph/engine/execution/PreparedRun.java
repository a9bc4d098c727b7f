package com.toolgraph.engine.execution;

import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.RunState;

/**
 * A run that has been created and stored as PENDING but not started yet.
 *
 * @param graph the graph as read once at run creation
 * @param run   the live run record, owned by whoever executes it
 */
public record PreparedRun(GraphDefinition graph, RunState run) {

    public String runId() { return run.getRunId(); }
}
