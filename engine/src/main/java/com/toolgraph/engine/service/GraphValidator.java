package com.toolgraph.engine.service;

import com.toolgraph.engine.guard.ConditionEvaluator;
import com.toolgraph.engine.guard.GuardSyntaxException;
import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.NodeDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks run before a graph is stored:
 * <ul>
 *   <li>at least one node; ids non-blank and unique; every node names a tool</li>
 *   <li>the start node and both endpoints of every edge exist</li>
 *   <li>every guard parses under the restricted guard grammar</li>
 * </ul>
 * Tool names are not checked against the registry: tools may be registered
 * after the graph.
 */
@Component
public class GraphValidator {

    private final ConditionEvaluator conditionEvaluator;

    public GraphValidator(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * @throws InvalidGraphException listing every problem, if there are any
     */
    public void validate(GraphDefinition graph) {
        List<String> problems = new ArrayList<>();
        Set<String> nodeIds = new HashSet<>();

        if (graph.nodes().isEmpty()) {
            problems.add("graph has no nodes");
        }
        for (NodeDefinition node : graph.nodes()) {
            if (node.id() == null || node.id().isBlank()) {
                problems.add("node with blank id");
                continue;
            }
            if (!nodeIds.add(node.id())) {
                problems.add("duplicate node id '" + node.id() + "'");
            }
            if (node.toolName() == null || node.toolName().isBlank()) {
                problems.add("node '" + node.id() + "' has no toolName");
            }
        }

        if (graph.startNodeId() == null || !nodeIds.contains(graph.startNodeId())) {
            problems.add("start node '" + graph.startNodeId() + "' is not a node of the graph");
        }

        for (int i = 0; i < graph.edges().size(); i++) {
            EdgeDefinition edge = graph.edges().get(i);
            if (!nodeIds.contains(edge.source())) {
                problems.add("edge #" + i + " source '" + edge.source() + "' is not a node of the graph");
            }
            if (!nodeIds.contains(edge.target())) {
                problems.add("edge #" + i + " target '" + edge.target() + "' is not a node of the graph");
            }
            if (!edge.isUnconditional()) {
                try {
                    conditionEvaluator.compile(edge.condition());
                } catch (GuardSyntaxException e) {
                    problems.add("edge #" + i + " (" + edge.source() + " -> " + edge.target()
                            + ") has an invalid condition: " + e.getMessage());
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new InvalidGraphException(problems);
        }
    }
}
