package com.toolgraph.engine.service;

import com.toolgraph.engine.execution.EngineContext;
import com.toolgraph.engine.execution.ExecutionEngine;
import com.toolgraph.engine.guard.ConditionEvaluator;
import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.NodeDefinition;
import com.toolgraph.engine.model.RunLogEntry;
import com.toolgraph.engine.model.RunState;
import com.toolgraph.engine.model.RunStatus;
import com.toolgraph.engine.store.GraphNotFoundException;
import com.toolgraph.engine.store.InMemoryGraphStore;
import com.toolgraph.engine.store.InMemoryRunStore;
import com.toolgraph.engine.store.RunNotFoundException;
import com.toolgraph.engine.tool.ImmediateTool;
import com.toolgraph.engine.tool.ToolRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for RunService: synchronous runs, background runs and cancellation.
 *
 * Wires the real engine, registry and in-memory stores; background runs are
 * awaited by polling the run store.
 */
class RunServiceTest {

    ToolRegistry       tools;
    InMemoryGraphStore graphStore;
    InMemoryRunStore   runStore;
    RunService         service;

    final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        tools      = new ToolRegistry(List.of(), meterRegistry, 5);
        graphStore = new InMemoryGraphStore();
        runStore   = new InMemoryRunStore();
        ExecutionEngine engine = new ExecutionEngine(new ConditionEvaluator(), meterRegistry, 10);
        service = new RunService(engine, new EngineContext(graphStore, runStore, tools), 2);

        tools.register("inc", ImmediateTool.of(s -> Map.of(
                "count", ((Number) s.getOrDefault("count", 0)).intValue() + 1)));
        tools.register("gate", ImmediateTool.of(s -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Map.of("gated", true);
        }));

        graphStore.put(new GraphDefinition("single",
                List.of(new NodeDefinition("A", "inc")), List.of(), "A"));
        graphStore.put(new GraphDefinition("gated",
                List.of(new NodeDefinition("A", "gate"), new NodeDefinition("B", "inc")),
                List.of(new EdgeDefinition("A", "B")), "A"));
        graphStore.put(new GraphDefinition("three-step",
                List.of(new NodeDefinition("A", "inc"), new NodeDefinition("B", "gate"),
                        new NodeDefinition("C", "inc")),
                List.of(new EdgeDefinition("A", "B"), new EdgeDefinition("B", "C")), "A"));
        graphStore.put(new GraphDefinition("forever",
                List.of(new NodeDefinition("L", "inc")),
                List.of(new EdgeDefinition("L", "L")), "L"));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        service.shutdown();
    }

    private RunState awaitStatus(String runId, Predicate<RunStatus> done) throws InterruptedException {
        return awaitRun(runId, run -> done.test(run.getStatus()));
    }

    private RunState awaitRun(String runId, Predicate<RunState> done) throws InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(5));
        while (Instant.now().isBefore(deadline)) {
            RunState run = runStore.get(runId);
            if (done.test(run)) {
                return run;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Run " + runId + " did not reach the expected state in time");
    }

    // ------------------------------------------------------------------
    // run (synchronous)
    // ------------------------------------------------------------------

    @Test
    void run_returnsTerminalRun() {
        RunState run = service.run("single", Map.of("count", 41), null);

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getState()).containsEntry("count", 42);
        assertThat(service.isActive(run.getRunId())).isFalse();
    }

    @Test
    void run_nullMaxSteps_usesEngineDefault() {
        RunState run = service.run("forever", Map.of(), null);

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getStepCount()).isEqualTo(10);
    }

    @Test
    void run_explicitMaxSteps_overridesDefault() {
        RunState run = service.run("forever", Map.of(), 3);

        assertThat(run.getStepCount()).isEqualTo(3);
    }

    @Test
    void run_invalidMaxSteps_rejected() {
        assertThatThrownBy(() -> service.run("single", Map.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void run_unknownGraph_throwsGraphNotFound() {
        assertThatThrownBy(() -> service.run("nope", Map.of(), null))
                .isInstanceOf(GraphNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // submit (background)
    // ------------------------------------------------------------------

    @Test
    void submit_returnsPendingRunThatLaterCompletes() throws Exception {
        RunState accepted = service.submit("single", Map.of(), null);

        assertThat(accepted.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(service.findById(accepted.getRunId())).isPresent();

        RunState done = awaitStatus(accepted.getRunId(), RunStatus::isTerminal);
        assertThat(done.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(done.getState()).containsEntry("count", 1);
    }

    @Test
    void submit_concurrentRuns_keepSeparateStateAndLogs() throws Exception {
        RunState first  = service.submit("gated", Map.of("count", 10, "owner", "first"), null);
        RunState second = service.submit("gated", Map.of("count", 100, "owner", "second"), null);

        // Both runs are parked inside the gate tool, one per worker.
        awaitStatus(first.getRunId(),  s -> s == RunStatus.RUNNING);
        awaitStatus(second.getRunId(), s -> s == RunStatus.RUNNING);
        assertThat(service.isActive(first.getRunId())).isTrue();
        assertThat(service.isActive(second.getRunId())).isTrue();

        release.countDown();

        RunState firstDone  = awaitStatus(first.getRunId(),  RunStatus::isTerminal);
        RunState secondDone = awaitStatus(second.getRunId(), RunStatus::isTerminal);

        assertThat(firstDone.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(secondDone.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(firstDone.getState())
                .containsEntry("count", 11).containsEntry("owner", "first").containsEntry("gated", true);
        assertThat(secondDone.getState())
                .containsEntry("count", 101).containsEntry("owner", "second").containsEntry("gated", true);
        assertThat(firstDone.getLogs()).extracting(e -> e.stateSnapshot().get("owner"))
                .containsExactly("first", "first");
        assertThat(secondDone.getLogs()).extracting(e -> e.stateSnapshot().get("owner"))
                .containsExactly("second", "second");
    }

    @Test
    void submit_pollingMidRun_seesRunningWithLogPrefix() throws Exception {
        RunState accepted = service.submit("three-step", Map.of(), null);

        // Node A has run and the run is parked in the gate at node B.
        RunState partial = awaitRun(accepted.getRunId(),
                r -> r.getStatus() == RunStatus.RUNNING && !r.getLogs().isEmpty());
        assertThat(partial.getCurrentNodeId()).isEqualTo("B");
        assertThat(partial.getLogs()).extracting(RunLogEntry::nodeId).containsExactly("A");
        assertThat(partial.getState()).containsEntry("count", 1).doesNotContainKey("gated");

        release.countDown();
        RunState done = awaitStatus(accepted.getRunId(), RunStatus::isTerminal);

        assertThat(done.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(done.getLogs()).extracting(RunLogEntry::nodeId).containsExactly("A", "B", "C");
        assertThat(done.getLogs().subList(0, partial.getLogs().size())).isEqualTo(partial.getLogs());
        assertThat(done.getState()).containsEntry("count", 2).containsEntry("gated", true);
    }

    @Test
    void submit_unknownGraph_throwsSynchronously() {
        assertThatThrownBy(() -> service.submit("nope", Map.of(), null))
                .isInstanceOf(GraphNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_runningRun_endsCancelled() throws Exception {
        RunState accepted = service.submit("gated", Map.of(), null);
        awaitStatus(accepted.getRunId(), s -> s != RunStatus.PENDING);

        service.cancel(accepted.getRunId());
        release.countDown();

        RunState done = awaitStatus(accepted.getRunId(), RunStatus::isTerminal);
        assertThat(done.getStatus()).isEqualTo(RunStatus.CANCELLED);
        assertThat(done.getState()).doesNotContainKey("count");
        assertThat(done.getLogs()).last().extracting(RunLogEntry::message).asString().contains("cancelled");
    }

    @Test
    void cancel_finishedRun_throwsAlreadyFinished() {
        RunState run = service.run("single", Map.of(), null);

        assertThatThrownBy(() -> service.cancel(run.getRunId()))
                .isInstanceOf(RunAlreadyFinishedException.class)
                .hasMessageContaining("COMPLETED");
    }

    @Test
    void cancel_unknownRun_throwsRunNotFound() {
        assertThatThrownBy(() -> service.cancel("nope"))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void findById_unknownRun_isEmpty() {
        assertThat(service.findById("nope")).isEmpty();
    }
}
