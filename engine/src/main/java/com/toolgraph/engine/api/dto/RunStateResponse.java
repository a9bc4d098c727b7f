package com.toolgraph.engine.api.dto;

import com.toolgraph.engine.model.RunLogEntry;
import com.toolgraph.engine.model.RunState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a run returned by GET /graph/state/{runId}.
 *
 * For a run still in progress this is the record as of its last completed
 * step: currentNodeId is the node about to execute and logs is a prefix of
 * the eventual log.
 */
public record RunStateResponse(
        String              runId,
        String              graphId,
        String              status,
        String              currentNodeId,
        String              failureReason,
        int                 stepCount,
        Map<String, Object> state,
        List<RunLogEntry>   logs,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static RunStateResponse from(RunState run) {
        return new RunStateResponse(
                run.getRunId(),
                run.getGraphId(),
                run.getStatus().name(),
                run.getCurrentNodeId(),
                run.getFailureReason() == null ? null : run.getFailureReason().name(),
                run.getStepCount(),
                run.getState(),
                run.getLogs(),
                run.getCreatedAt(),
                run.getUpdatedAt()
        );
    }
}
