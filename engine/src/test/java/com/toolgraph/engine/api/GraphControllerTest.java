package com.toolgraph.engine.api;

import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.FailureReason;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.NodeDefinition;
import com.toolgraph.engine.model.RunState;
import com.toolgraph.engine.model.RunStatus;
import com.toolgraph.engine.service.GraphService;
import com.toolgraph.engine.service.InvalidGraphException;
import com.toolgraph.engine.service.RunAlreadyFinishedException;
import com.toolgraph.engine.service.RunService;
import com.toolgraph.engine.store.GraphNotFoundException;
import com.toolgraph.engine.store.RunNotFoundException;
import com.toolgraph.engine.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for GraphController.
 *
 * @WebMvcTest spins up only the web layer; the services and the tool
 * registry are mocks, so no run ever executes here.
 */
@WebMvcTest(GraphController.class)
class GraphControllerTest {

    @Autowired MockMvc       mockMvc;
    @MockitoBean GraphService graphService;
    @MockitoBean RunService   runService;
    @MockitoBean ToolRegistry toolRegistry;

    // ------------------------------------------------------------------
    // POST /graph/create
    // ------------------------------------------------------------------

    @Test
    void create_validGraph_returnsGraphId() throws Exception {
        when(graphService.create(any(), any(), eq("a")))
                .thenReturn(new GraphDefinition("g-123", List.of(new NodeDefinition("a", "t")), List.of(), "a"));

        mockMvc.perform(post("/graph/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"nodes":[{"id":"a","toolName":"t"}],"edges":[],"startNodeId":"a"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graphId").value("g-123"));
    }

    @Test
    void create_invalidGraph_returns400() throws Exception {
        when(graphService.create(any(), any(), any()))
                .thenThrow(new InvalidGraphException(List.of("start node 'x' is not a node of the graph")));

        mockMvc.perform(post("/graph/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"nodes":[{"id":"a","toolName":"t"}],"edges":[],"startNodeId":"x"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /graph/list, GET /graph/{graphId}
    // ------------------------------------------------------------------

    @Test
    void listGraphs_returnsIds() throws Exception {
        when(graphService.graphIds()).thenReturn(List.of("code_review_graph", "g1"));

        mockMvc.perform(get("/graph/list"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("code_review_graph"))
                .andExpect(jsonPath("$[1]").value("g1"));
    }

    @Test
    void getGraph_existingId_returnsDefinition() throws Exception {
        GraphDefinition graph = new GraphDefinition("g1",
                List.of(new NodeDefinition("a", "t"), new NodeDefinition("b", "t")),
                List.of(new EdgeDefinition("a", "b", "state['x'] > 1")), "a");
        when(graphService.findById("g1")).thenReturn(Optional.of(graph));

        mockMvc.perform(get("/graph/{graphId}", "g1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.startNodeId").value("a"))
                .andExpect(jsonPath("$.nodes[1].toolName").value("t"))
                .andExpect(jsonPath("$.edges[0].condition").value("state['x'] > 1"))
                .andExpect(jsonPath("$.edges[0].unconditional").doesNotExist());
    }

    @Test
    void getGraph_unknownId_returns404() throws Exception {
        when(graphService.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/graph/{graphId}", "nope"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /graph/run
    // ------------------------------------------------------------------

    @Test
    void run_completedRun_returnsFinalStateAndLogs() throws Exception {
        RunState run = completedRun();
        when(runService.run(eq("g1"), anyMap(), isNull())).thenReturn(run);

        mockMvc.perform(post("/graph/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"graphId":"g1","initialState":{"code":"def f(): pass"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(run.getRunId()))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.finalState.quality_score").value(90))
                .andExpect(jsonPath("$.logs[0].nodeId").value("a"))
                .andExpect(jsonPath("$.logs[0].message").value("Executed tool 't'"));
    }

    @Test
    void run_failedRun_stillReturns200WithFailureReason() throws Exception {
        RunState run = RunState.start("g1", "a", Map.of());
        run.markRunning();
        run.appendLog("a", "Node 'a' not found in graph");
        run.fail(FailureReason.NODE_MISSING);
        when(runService.run(any(), any(), any())).thenReturn(run);

        mockMvc.perform(post("/graph/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"graphId":"g1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.failureReason").value("NODE_MISSING"));
    }

    @Test
    void run_missingInitialState_defaultsToEmptyMap() throws Exception {
        when(runService.run(any(), any(), any())).thenReturn(completedRun());

        mockMvc.perform(post("/graph/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"graphId":"g1","maxSteps":7}
                                """))
                .andExpect(status().isOk());

        verify(runService).run("g1", Map.of(), 7);
    }

    @Test
    void run_unknownGraph_returns404() throws Exception {
        when(runService.run(any(), any(), any())).thenThrow(new GraphNotFoundException("nope"));

        mockMvc.perform(post("/graph/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"graphId":"nope"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void run_invalidMaxSteps_returns400() throws Exception {
        when(runService.run(any(), any(), any()))
                .thenThrow(new IllegalArgumentException("maxSteps must be at least 1, got 0"));

        mockMvc.perform(post("/graph/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"graphId":"g1","maxSteps":0}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /graph/run/async
    // ------------------------------------------------------------------

    @Test
    void runAsync_returns202WithPendingRun() throws Exception {
        RunState run = RunState.start("g1", "a", Map.of());
        when(runService.submit(any(), any(), any())).thenReturn(run);

        mockMvc.perform(post("/graph/run/async")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"graphId":"g1"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value(run.getRunId()))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    // ------------------------------------------------------------------
    // GET /graph/state/{runId}
    // ------------------------------------------------------------------

    @Test
    void getRun_existingRun_returns200() throws Exception {
        RunState run = completedRun();
        when(runService.findById(run.getRunId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/graph/state/{runId}", run.getRunId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graphId").value("g1"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.stepCount").value(1))
                .andExpect(jsonPath("$.state.quality_score").value(90));
    }

    @Test
    void getRun_unknownRun_returns404() throws Exception {
        when(runService.findById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/graph/state/{runId}", "missing"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /graph/state/{runId}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_activeRun_returns202() throws Exception {
        RunState run = RunState.start("g1", "a", Map.of());
        run.markRunning();
        when(runService.cancel(run.getRunId())).thenReturn(run);

        mockMvc.perform(post("/graph/state/{runId}/cancel", run.getRunId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void cancel_finishedRun_returns409() throws Exception {
        when(runService.cancel("done"))
                .thenThrow(new RunAlreadyFinishedException("done", RunStatus.COMPLETED));

        mockMvc.perform(post("/graph/state/{runId}/cancel", "done"))
                .andExpect(status().isConflict());
    }

    @Test
    void cancel_unknownRun_returns404() throws Exception {
        when(runService.cancel("missing")).thenThrow(new RunNotFoundException("missing"));

        mockMvc.perform(post("/graph/state/{runId}/cancel", "missing"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /graph/tools
    // ------------------------------------------------------------------

    @Test
    void tools_listsRegisteredNames() throws Exception {
        when(toolRegistry.toolNames()).thenReturn(List.of("check_complexity", "extract_functions"));

        mockMvc.perform(get("/graph/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("check_complexity"))
                .andExpect(jsonPath("$[1]").value("extract_functions"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static RunState completedRun() {
        RunState run = RunState.start("g1", "a", Map.of("code", "def f(): pass"));
        run.markRunning();
        run.merge(Map.of("quality_score", 90));
        run.incrementStepCount();
        run.appendLog("a", "Executed tool 't'");
        run.complete();
        return run;
    }
}
