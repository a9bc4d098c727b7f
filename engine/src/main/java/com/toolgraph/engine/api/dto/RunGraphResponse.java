package com.toolgraph.engine.api.dto;

import com.toolgraph.engine.model.RunLogEntry;
import com.toolgraph.engine.model.RunState;

import java.util.List;
import java.util.Map;

/**
 * Response body for POST /graph/run: the terminal run.
 * {@code failureReason} is null unless {@code status} is FAILED.
 */
public record RunGraphResponse(
        String              runId,
        String              status,
        String              failureReason,
        Map<String, Object> finalState,
        List<RunLogEntry>   logs
) {
    public static RunGraphResponse from(RunState run) {
        return new RunGraphResponse(
                run.getRunId(),
                run.getStatus().name(),
                run.getFailureReason() == null ? null : run.getFailureReason().name(),
                run.getState(),
                run.getLogs()
        );
    }
}
