package com.toolgraph.engine.store;

import com.toolgraph.engine.model.RunState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime run storage.
 *
 * Every put stores a fresh snapshot and every get returns another one, so the
 * live RunState owned by an engine never leaks out through the store.
 */
@Component
public class InMemoryRunStore implements RunStore {

    private final Map<String, RunState> runs = new ConcurrentHashMap<>();

    @Override
    public void put(RunState run) {
        Objects.requireNonNull(run, "run");
        runs.put(run.getRunId(), run.snapshot());
    }

    @Override
    public RunState get(String runId) {
        return find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    @Override
    public Optional<RunState> find(String runId) {
        if (runId == null) return Optional.empty();
        RunState stored = runs.get(runId);
        return stored == null ? Optional.empty() : Optional.of(stored.snapshot());
    }
}
