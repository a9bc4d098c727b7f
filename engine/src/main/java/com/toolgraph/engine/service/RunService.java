package com.toolgraph.engine.service;

import com.toolgraph.engine.execution.CancellationSignal;
import com.toolgraph.engine.execution.EngineContext;
import com.toolgraph.engine.execution.ExecutionEngine;
import com.toolgraph.engine.execution.PreparedRun;
import com.toolgraph.engine.model.RunState;
import com.toolgraph.engine.store.RunNotFoundException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Run lifecycle: synchronous and background execution, lookup, cancellation.
 *
 * Background runs go to a fixed worker pool. Each worker drives one run at a
 * time, so the pool size caps how many runs are in flight and a slow tool
 * only ever holds up its own run.
 *
 * A cancellation signal is kept for every run that has not finished yet;
 * {@link #cancel} triggers it and the engine stops before its next node.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final ExecutionEngine engine;
    private final EngineContext   context;
    private final ExecutorService workers;

    private final Map<String, CancellationSignal> active = new ConcurrentHashMap<>();

    public RunService(ExecutionEngine engine,
                      EngineContext context,
                      @Value("${toolgraph.runs.worker-count:4}") int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("toolgraph.runs.worker-count must be at least 1");
        }
        this.engine  = engine;
        this.context = context;
        this.workers = Executors.newFixedThreadPool(workerCount);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Execute a graph to completion on the calling thread.
     *
     * @param maxSteps step limit, or null for the configured default
     * @throws com.toolgraph.engine.store.GraphNotFoundException if the graph is unknown
     */
    public RunState run(String graphId, Map<String, ?> initialState, Integer maxSteps) {
        int limit = resolveMaxSteps(maxSteps);
        PreparedRun prepared = engine.prepare(context, graphId, initialState);
        CancellationSignal signal = new CancellationSignal();
        active.put(prepared.runId(), signal);
        try {
            return engine.execute(context, prepared, limit, signal);
        } finally {
            active.remove(prepared.runId());
        }
    }

    /**
     * Create the run now and execute it on a worker thread. The run id is
     * usable for polling as soon as this method returns.
     *
     * @return snapshot of the freshly created (PENDING) run
     * @throws com.toolgraph.engine.store.GraphNotFoundException if the graph is unknown
     */
    public RunState submit(String graphId, Map<String, ?> initialState, Integer maxSteps) {
        int limit = resolveMaxSteps(maxSteps);
        PreparedRun prepared = engine.prepare(context, graphId, initialState);
        RunState accepted = prepared.run().snapshot();
        String runId = prepared.runId();

        CancellationSignal signal = new CancellationSignal();
        active.put(runId, signal);
        try {
            workers.submit(() -> {
                try {
                    engine.execute(context, prepared, limit, signal);
                } catch (Exception e) {
                    log.error("Unhandled error while executing run {}: {}", runId, e.getMessage(), e);
                } finally {
                    active.remove(runId);
                }
            });
        } catch (RejectedExecutionException e) {
            active.remove(runId);
            throw e;
        }
        log.info("Run {} of graph {} queued (maxSteps={})", runId, graphId, limit);
        return accepted;
    }

    // ------------------------------------------------------------------
    // Queries and control
    // ------------------------------------------------------------------

    public Optional<RunState> findById(String runId) {
        return context.runStore().find(runId);
    }

    /**
     * Ask a run to stop before its next node.
     *
     * @return the run as currently stored; it may still show RUNNING until the
     *         engine observes the signal
     * @throws RunNotFoundException        if the run is unknown
     * @throws RunAlreadyFinishedException if the run already reached a terminal status
     */
    public RunState cancel(String runId) {
        RunState current = context.runStore().get(runId);
        CancellationSignal signal = active.get(runId);
        if (signal == null) {
            // Finished between the two reads, or already terminal; report the stored status.
            throw new RunAlreadyFinishedException(runId, context.runStore().get(runId).getStatus());
        }
        if (current.getStatus().isTerminal()) {
            throw new RunAlreadyFinishedException(runId, current.getStatus());
        }
        if (signal.cancel()) {
            log.info("Cancellation requested for run {}", runId);
        }
        return context.runStore().get(runId);
    }

    public boolean isActive(String runId) {
        return active.containsKey(runId);
    }

    @PreDestroy
    public void shutdown() {
        active.values().forEach(CancellationSignal::cancel);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private int resolveMaxSteps(Integer maxSteps) {
        if (maxSteps == null) {
            return engine.defaultMaxSteps();
        }
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        return maxSteps;
    }
}
