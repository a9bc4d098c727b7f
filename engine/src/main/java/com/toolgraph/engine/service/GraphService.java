package com.toolgraph.engine.service;

import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.NodeDefinition;
import com.toolgraph.engine.store.GraphStore;
import com.toolgraph.engine.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Graph registration: validation first, then storage. A graph that fails
 * validation is never stored.
 */
@Service
public class GraphService {

    private static final Logger log = LoggerFactory.getLogger(GraphService.class);

    private final GraphStore     graphStore;
    private final GraphValidator validator;
    private final ToolRegistry   toolRegistry;

    public GraphService(GraphStore graphStore, GraphValidator validator, ToolRegistry toolRegistry) {
        this.graphStore   = graphStore;
        this.validator    = validator;
        this.toolRegistry = toolRegistry;
    }

    /**
     * Create a graph under a freshly generated id.
     *
     * @throws InvalidGraphException if the definition is malformed
     */
    public GraphDefinition create(List<NodeDefinition> nodes, List<EdgeDefinition> edges, String startNodeId) {
        return register(new GraphDefinition(UUID.randomUUID().toString(), nodes, edges, startNodeId));
    }

    /**
     * Validate and store {@code graph} under its own id, replacing any graph
     * already stored there.
     *
     * @throws InvalidGraphException if the definition is malformed
     */
    public GraphDefinition register(GraphDefinition graph) {
        validator.validate(graph);
        graph.nodes().stream()
                .map(NodeDefinition::toolName)
                .filter(name -> !toolRegistry.contains(name))
                .distinct()
                .forEach(name -> log.warn("Graph {} references tool '{}' which is not registered yet",
                        graph.id(), name));
        graphStore.put(graph);
        log.info("Registered graph {} ({} nodes, {} edges, start='{}')",
                graph.id(), graph.nodes().size(), graph.edges().size(), graph.startNodeId());
        return graph;
    }

    public Optional<GraphDefinition> findById(String graphId) {
        return graphStore.find(graphId);
    }

    public List<String> graphIds() {
        return graphStore.ids();
    }
}
