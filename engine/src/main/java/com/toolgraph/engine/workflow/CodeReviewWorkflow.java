package com.toolgraph.engine.workflow;

import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.NodeDefinition;

import java.util.List;

/**
 * The example "code review" graph:
 *
 * <pre>
 *   extract → complexity → issues → suggest
 *                 ↑                    │
 *                 └── quality_score < threshold (default 80)
 * </pre>
 *
 * The review tools are deterministic, so code that scores below the
 * threshold on the first pass keeps looping until the step limit fails the
 * run. That is the behaviour the example demonstrates.
 */
public final class CodeReviewWorkflow {

    public static final String GRAPH_ID = "code_review_graph";

    public static final String LOOP_CONDITION =
            "state.get('quality_score', 0) < state.get('threshold', 80)";

    private CodeReviewWorkflow() {}

    public static GraphDefinition graph() {
        return new GraphDefinition(
                GRAPH_ID,
                List.of(
                        new NodeDefinition("extract",    "extract_functions"),
                        new NodeDefinition("complexity", "check_complexity"),
                        new NodeDefinition("issues",     "detect_basic_issues"),
                        new NodeDefinition("suggest",    "suggest_improvements")),
                List.of(
                        new EdgeDefinition("extract",    "complexity"),
                        new EdgeDefinition("complexity", "issues"),
                        new EdgeDefinition("issues",     "suggest"),
                        new EdgeDefinition("suggest",    "complexity", LOOP_CONDITION)),
                "extract");
    }
}
