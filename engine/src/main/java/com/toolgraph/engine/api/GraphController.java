package com.toolgraph.engine.api;

import com.toolgraph.engine.api.dto.CreateGraphRequest;
import com.toolgraph.engine.api.dto.CreateGraphResponse;
import com.toolgraph.engine.api.dto.RunAcceptedResponse;
import com.toolgraph.engine.api.dto.RunGraphRequest;
import com.toolgraph.engine.api.dto.RunGraphResponse;
import com.toolgraph.engine.api.dto.RunStateResponse;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.RunState;
import com.toolgraph.engine.service.GraphService;
import com.toolgraph.engine.service.InvalidGraphException;
import com.toolgraph.engine.service.RunAlreadyFinishedException;
import com.toolgraph.engine.service.RunService;
import com.toolgraph.engine.store.GraphNotFoundException;
import com.toolgraph.engine.store.RunNotFoundException;
import com.toolgraph.engine.tool.ToolRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for graphs and runs.
 *
 *   POST /graph/create                register a new graph, returns its id
 *   GET  /graph/list                  ids of all registered graphs
 *   GET  /graph/{graphId}             a registered graph definition
 *   POST /graph/run                   execute a graph and wait for the terminal run
 *   POST /graph/run/async             start a run in the background, returns its id
 *   GET  /graph/state/{runId}         poll a run's status, state and log
 *   POST /graph/state/{runId}/cancel  stop a run before its next node
 *   GET  /graph/tools                 names of the registered tools
 */
@RestController
@RequestMapping("/graph")
public class GraphController {

    private final GraphService graphService;
    private final RunService   runService;
    private final ToolRegistry toolRegistry;

    public GraphController(GraphService graphService, RunService runService, ToolRegistry toolRegistry) {
        this.graphService = graphService;
        this.runService   = runService;
        this.toolRegistry = toolRegistry;
    }

    /**
     * Register a new graph.
     *
     * Example:
     *   curl -X POST http://localhost:8080/graph/create \
     *     -H "Content-Type: application/json" \
     *     -d '{"nodes":[{"id":"a","toolName":"check_complexity"}],"edges":[],"startNodeId":"a"}'
     *
     * Returns 400 with every validation problem if the graph is malformed.
     */
    @PostMapping("/create")
    public CreateGraphResponse create(@RequestBody CreateGraphRequest req) {
        try {
            GraphDefinition graph = graphService.create(req.nodes(), req.edges(), req.startNodeId());
            return new CreateGraphResponse(graph.id());
        } catch (InvalidGraphException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("/list")
    public List<String> listGraphs() {
        return graphService.graphIds();
    }

    /** Returns 404 if the graph id is not registered. */
    @GetMapping("/{graphId}")
    public GraphDefinition getGraph(@PathVariable String graphId) {
        return graphService.findById(graphId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Graph not found: " + graphId));
    }

    /**
     * Execute a graph once from its start node and return the terminal run.
     *
     * In-run problems (missing node, failing tool, step limit) come back as a
     * FAILED run with HTTP 200; only an unknown graph id is a 404.
     */
    @PostMapping("/run")
    public RunGraphResponse run(@RequestBody RunGraphRequest req) {
        try {
            RunState run = runService.run(req.graphId(), req.initialState(), req.maxSteps());
            return RunGraphResponse.from(run);
        } catch (GraphNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Start a run on a background worker.
     *
     * HTTP 202: run created; poll GET /graph/state/{runId}
     * HTTP 404: graph id not found
     */
    @PostMapping("/run/async")
    public ResponseEntity<RunAcceptedResponse> runAsync(@RequestBody RunGraphRequest req) {
        try {
            RunState run = runService.submit(req.graphId(), req.initialState(), req.maxSteps());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunAcceptedResponse.from(run));
        } catch (GraphNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Poll the current state of a run.
     * Returns 404 if the run id is not found.
     */
    @GetMapping("/state/{runId}")
    public RunStateResponse getRun(@PathVariable String runId) {
        return runService.findById(runId)
                .map(RunStateResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + runId));
    }

    /**
     * Request cancellation of an in-flight run.
     *
     * HTTP 202: signal delivered; the run stops before its next node
     * HTTP 404: run id not found
     * HTTP 409: run already finished
     */
    @PostMapping("/state/{runId}/cancel")
    public ResponseEntity<RunStateResponse> cancel(@PathVariable String runId) {
        try {
            RunState run = runService.cancel(runId);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunStateResponse.from(run));
        } catch (RunNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (RunAlreadyFinishedException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }

    @GetMapping("/tools")
    public List<String> tools() {
        return toolRegistry.toolNames();
    }
}
