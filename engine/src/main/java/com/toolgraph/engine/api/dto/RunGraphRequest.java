package com.toolgraph.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /graph/run and POST /graph/run/async.
 *
 * Required: graphId
 * Optional: initialState (defaults to empty), maxSteps (defaults to
 *   toolgraph.engine.max-steps).
 */
public record RunGraphRequest(String graphId, Map<String, Object> initialState, Integer maxSteps) {

    public RunGraphRequest {
        if (initialState == null) initialState = Map.of();
    }
}
