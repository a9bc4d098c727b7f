package com.toolgraph.engine.api.dto;

import com.toolgraph.engine.model.RunState;

/**
 * Response body for POST /graph/run/async. Poll GET /graph/state/{runId}
 * for progress.
 */
public record RunAcceptedResponse(String runId, String graphId, String status) {

    public static RunAcceptedResponse from(RunState run) {
        return new RunAcceptedResponse(run.getRunId(), run.getGraphId(), run.getStatus().name());
    }
}
