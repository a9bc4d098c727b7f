package com.toolgraph.engine.execution;

import com.toolgraph.engine.guard.ConditionEvaluator;
import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.FailureReason;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.NodeDefinition;
import com.toolgraph.engine.model.RunState;
import com.toolgraph.engine.model.RunStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * The graph interpreter.
 *
 * For one run, this class:
 *   1. Resolves the current node in the graph
 *   2. Invokes the node's tool through the ToolRegistry with the run state
 *   3. Merges the returned map into the state (returned keys win)
 *   4. Appends a log entry with a snapshot of the merged state
 *   5. Asks the ConditionEvaluator for the next edge
 *   6. Completes when there is none, otherwise moves along the edge and repeats
 *
 * Loops are allowed; {@code maxSteps} bounds the number of node executions.
 * Every in-run problem ends the run in a terminal status with a log entry,
 * including an unexpected exception from the engine itself (INTERNAL_ERROR). Only an unknown graph id
 * or an invalid {@code maxSteps} is thrown, and both are detected before a run
 * record exists.
 */
@Component
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final ConditionEvaluator conditionEvaluator;
    private final MeterRegistry      meterRegistry;
    private final int                defaultMaxSteps;

    public ExecutionEngine(ConditionEvaluator conditionEvaluator,
                           MeterRegistry meterRegistry,
                           @Value("${toolgraph.engine.max-steps:100}") int defaultMaxSteps) {
        this.conditionEvaluator = conditionEvaluator;
        this.meterRegistry      = meterRegistry;
        this.defaultMaxSteps    = requireValidMaxSteps(defaultMaxSteps);
    }

    public int defaultMaxSteps() {
        return defaultMaxSteps;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** {@link #runOnce(EngineContext, String, Map, int)} with the configured step limit. */
    public RunState runOnce(EngineContext ctx, String graphId, Map<String, ?> initialState) {
        return runOnce(ctx, graphId, initialState, defaultMaxSteps);
    }

    /**
     * Execute a graph from its start node until no next edge is found, a
     * failure occurs, or {@code maxSteps} nodes have executed.
     *
     * @return the terminal run (COMPLETED or FAILED)
     * @throws com.toolgraph.engine.store.GraphNotFoundException if {@code graphId} is unknown
     * @throws IllegalArgumentException if {@code maxSteps} is less than 1
     */
    public RunState runOnce(EngineContext ctx, String graphId, Map<String, ?> initialState, int maxSteps) {
        requireValidMaxSteps(maxSteps);
        return execute(ctx, create(ctx, graphId, initialState, true), maxSteps, CancellationSignal.none());
    }

    /**
     * Resolve the graph and create the run record (PENDING, positioned on the
     * start node, private copy of {@code initialState}) for a later
     * {@link #execute}. The record is stored before this method returns.
     *
     * @throws com.toolgraph.engine.store.GraphNotFoundException if {@code graphId} is unknown;
     *         no record is created in that case
     */
    public PreparedRun prepare(EngineContext ctx, String graphId, Map<String, ?> initialState) {
        return create(ctx, graphId, initialState, false);
    }

    // A run started right away is never stored as PENDING.
    private PreparedRun create(EngineContext ctx, String graphId, Map<String, ?> initialState,
                               boolean startNow) {
        GraphDefinition graph = ctx.graphStore().get(graphId);
        RunState run = RunState.start(graph.id(), graph.startNodeId(), initialState);
        if (startNow) {
            run.markRunning();
        }
        ctx.runStore().put(run);
        log.debug("Created run {} for graph {}", run.getRunId(), graph.id());
        return new PreparedRun(graph, run);
    }

    /**
     * Drive a prepared run to a terminal status. Blocks the calling thread
     * while tools execute; runs are independent, so many can be executed
     * concurrently on different threads.
     *
     * @return the same (now terminal) run object
     */
    public RunState execute(EngineContext ctx, PreparedRun prepared, int maxSteps, CancellationSignal signal) {
        requireValidMaxSteps(maxSteps);
        RunState run = prepared.run();
        if (run.getStatus() != RunStatus.RUNNING) {
            run.markRunning();
        }

        // Remove only our own keys: on the synchronous path this runs on a
        // request thread whose other MDC entries must survive.
        MDC.put("runId",   run.getRunId());
        MDC.put("graphId", run.getGraphId());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ctx.runStore().put(run);
            log.info("Starting run {} of graph {} at node '{}' (maxSteps={})",
                    run.getRunId(), run.getGraphId(), run.getCurrentNodeId(), maxSteps);

            step(ctx, prepared.graph(), run, maxSteps, signal);
            return run;
        } catch (VirtualMachineError e) {
            abortInternal(run, e);
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Run {} aborted by an unexpected error at node '{}'",
                    run.getRunId(), run.getCurrentNodeId(), e);
            abortInternal(run, e);
            return run;
        } finally {
            ctx.runStore().put(run);
            String statusTag = run.getStatus().name().toLowerCase();
            sample.stop(meterRegistry.timer("toolgraph.run.duration", "status", statusTag));
            meterRegistry.counter("toolgraph.runs", "status", statusTag).increment();
            if (run.getStatus() == RunStatus.FAILED) {
                log.warn("Run {} FAILED ({}) after {} steps",
                        run.getRunId(), run.getFailureReason(), run.getStepCount());
            } else {
                log.info("Run {} {} after {} steps", run.getRunId(), run.getStatus(), run.getStepCount());
            }
            MDC.remove("runId");
            MDC.remove("graphId");
        }
    }

    // ------------------------------------------------------------------
    // Step loop
    // ------------------------------------------------------------------

    private void step(EngineContext ctx, GraphDefinition graph, RunState run,
                      int maxSteps, CancellationSignal signal) {
        String currentNodeId = run.getCurrentNodeId();

        for (int i = 0; i < maxSteps; i++) {
            if (signal.isCancelled()) {
                run.appendLog(currentNodeId, "Run cancelled before executing node '" + currentNodeId + "'");
                run.cancel();
                return;
            }

            Optional<NodeDefinition> found = graph.findNode(currentNodeId);
            if (found.isEmpty()) {
                run.appendLog(currentNodeId, "Node '" + currentNodeId + "' not found in graph");
                run.fail(FailureReason.NODE_MISSING);
                return;
            }
            NodeDefinition node = found.get();

            Map<String, Object> update;
            try {
                update = ctx.toolRegistry().run(node.toolName(), run.getState());
            } catch (RuntimeException e) {
                log.warn("Tool '{}' failed at node '{}' of run {}: {}",
                        node.toolName(), node.id(), run.getRunId(), e.getMessage());
                run.appendLog(node.id(),
                        "Tool '" + node.toolName() + "' failed at node '" + node.id() + "': " + e.getMessage());
                run.fail(FailureReason.TOOL_FAILED);
                return;
            }

            run.merge(update);
            run.incrementStepCount();
            run.appendLog(node.id(), "Executed tool '" + node.toolName() + "'");
            log.debug("Step {}/{}: node '{}' executed tool '{}'",
                    run.getStepCount(), maxSteps, node.id(), node.toolName());

            Optional<EdgeDefinition> next =
                    conditionEvaluator.selectNext(graph.outgoingEdges(node.id()), run.getState());
            if (next.isEmpty()) {
                run.complete();
                return;
            }

            currentNodeId = next.get().target();
            run.moveTo(currentNodeId);
            // Per-step visibility for pollers.
            ctx.runStore().put(run);
        }

        run.appendLog(currentNodeId,
                "Max steps (" + maxSteps + ") reached; aborting (possible infinite loop)");
        run.fail(FailureReason.STEP_LIMIT_EXCEEDED);
    }

    /** Leaves the record FAILED when the step loop ends by throwing. */
    private static void abortInternal(RunState run, Throwable cause) {
        if (run.getStatus().isTerminal()) {
            return;
        }
        run.appendLog(run.getCurrentNodeId(), "Run aborted by an internal error: " + cause);
        run.fail(FailureReason.INTERNAL_ERROR);
    }

    private static int requireValidMaxSteps(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        return maxSteps;
    }
}
