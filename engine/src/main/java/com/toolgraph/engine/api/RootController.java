package com.toolgraph.engine.api;

import com.toolgraph.engine.workflow.CodeReviewWorkflow;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Liveness banner; also points at the bundled example graph. */
@RestController
public class RootController {

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of(
                "message", "ToolGraph workflow engine is running",
                "exampleGraphId", CodeReviewWorkflow.GRAPH_ID);
    }
}
