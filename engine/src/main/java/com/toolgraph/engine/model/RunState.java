package com.toolgraph.engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One execution instance of a graph: status, accumulated state and log.
 *
 * A RunState is owned by exactly one engine execution, which is the only
 * writer. Everything handed to the outside world (RunStore, API responses)
 * goes through {@link #snapshot()}, so observers never share the live object.
 * Once the status is terminal every mutator throws.
 */
public class RunState {

    private final String  runId;
    private final String  graphId;
    private final Instant createdAt;

    private RunStatus             status;
    private String                currentNodeId;
    private FailureReason         failureReason;
    private int                   stepCount;
    private Instant               updatedAt;
    private final Map<String, Object> state;
    private final List<RunLogEntry>   logs;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    /**
     * New PENDING run positioned on the start node. The initial state is
     * deep-copied so the run never aliases caller memory.
     */
    public static RunState start(String graphId, String startNodeId, Map<String, ?> initialState) {
        Instant now = Instant.now();
        return new RunState(UUID.randomUUID().toString(), graphId, now, now,
                RunStatus.PENDING, startNodeId, null, 0,
                StateCopier.copy(initialState), new ArrayList<>());
    }

    private RunState(String runId, String graphId, Instant createdAt, Instant updatedAt,
                     RunStatus status, String currentNodeId, FailureReason failureReason,
                     int stepCount, Map<String, Object> state, List<RunLogEntry> logs) {
        this.runId         = runId;
        this.graphId       = graphId;
        this.createdAt     = createdAt;
        this.updatedAt     = updatedAt;
        this.status        = status;
        this.currentNodeId = currentNodeId;
        this.failureReason = failureReason;
        this.stepCount     = stepCount;
        this.state         = state;
        this.logs          = logs;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String        getRunId()         { return runId; }
    public String        getGraphId()       { return graphId; }
    public RunStatus     getStatus()        { return status; }
    public String        getCurrentNodeId() { return currentNodeId; }
    public FailureReason getFailureReason() { return failureReason; }
    public int           getStepCount()     { return stepCount; }
    public Instant       getCreatedAt()     { return createdAt; }
    public Instant       getUpdatedAt()     { return updatedAt; }

    /** Read-only view of the live state. Use {@link #snapshot()} for a stable copy. */
    public Map<String, Object> getState()   { return Collections.unmodifiableMap(state); }
    public List<RunLogEntry>   getLogs()    { return Collections.unmodifiableList(logs); }

    // ------------------------------------------------------------------
    // Mutators (engine only)
    // ------------------------------------------------------------------

    public void markRunning() {
        if (status != RunStatus.PENDING) {
            throw new IllegalStateException("Run " + runId + " cannot start from " + status);
        }
        status = RunStatus.RUNNING;
        touch();
    }

    /** Right-biased merge: keys in {@code update} replace existing keys, others are untouched. */
    public void merge(Map<String, ?> update) {
        ensureWritable();
        state.putAll(StateCopier.copy(update));
        touch();
    }

    public RunLogEntry appendLog(String nodeId, String message) {
        ensureWritable();
        RunLogEntry entry = new RunLogEntry(logs.size() + 1, nodeId, message, state, Instant.now());
        logs.add(entry);
        touch();
        return entry;
    }

    public void moveTo(String nodeId) {
        ensureWritable();
        currentNodeId = nodeId;
        touch();
    }

    public void incrementStepCount() {
        ensureWritable();
        stepCount++;
    }

    public void complete() {
        ensureWritable();
        status = RunStatus.COMPLETED;
        currentNodeId = null;
        touch();
    }

    public void fail(FailureReason reason) {
        ensureWritable();
        status = RunStatus.FAILED;
        failureReason = reason;
        touch();
    }

    public void cancel() {
        ensureWritable();
        status = RunStatus.CANCELLED;
        touch();
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    /**
     * Independent deep copy. Log entries are immutable and shared; the
     * list holding them is not.
     */
    public RunState snapshot() {
        return new RunState(runId, graphId, createdAt, updatedAt, status, currentNodeId,
                failureReason, stepCount, StateCopier.copy(state), new ArrayList<>(logs));
    }

    private void ensureWritable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is " + status + " and read-only");
        }
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "RunState[runId=" + runId + ", graphId=" + graphId + ", status=" + status
                + ", currentNodeId=" + currentNodeId + ", steps=" + stepCount + "]";
    }
}
