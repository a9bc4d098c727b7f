package com.toolgraph.engine.store;

import com.toolgraph.engine.model.RunState;

import java.util.Optional;

/**
 * Keyed storage of run records.
 *
 * Implementations store and hand out snapshots: a reader never shares the
 * object a running engine is mutating, and never observes a half-written
 * record.
 */
public interface RunStore {

    /** Idempotent upsert by run id. */
    void put(RunState run);

    /**
     * @throws RunNotFoundException if no run is stored under {@code runId}
     */
    RunState get(String runId);

    Optional<RunState> find(String runId);
}
