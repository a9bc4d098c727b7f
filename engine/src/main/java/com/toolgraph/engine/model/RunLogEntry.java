package com.toolgraph.engine.model;

import java.time.Instant;
import java.util.Map;

/**
 * One append-only entry in a run's log.
 *
 * @param step          1-based position of the entry in the log.
 * @param nodeId        Node the entry is about.
 * @param message       Human-readable description of what happened.
 * @param stateSnapshot Deep copy of the run state at the time of the entry;
 *                      later state changes never reach it.
 * @param timestamp     When the entry was appended.
 */
public record RunLogEntry(
        int                 step,
        String              nodeId,
        String              message,
        Map<String, Object> stateSnapshot,
        Instant             timestamp) {

    public RunLogEntry {
        stateSnapshot = StateCopier.freeze(stateSnapshot);
    }
}
