package com.toolgraph.engine.store;

import com.toolgraph.engine.model.GraphDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime graph storage. Nothing survives a restart.
 */
@Component
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, GraphDefinition> graphs = new ConcurrentHashMap<>();

    @Override
    public GraphDefinition get(String graphId) {
        return find(graphId).orElseThrow(() -> new GraphNotFoundException(graphId));
    }

    @Override
    public Optional<GraphDefinition> find(String graphId) {
        return graphId == null ? Optional.empty() : Optional.ofNullable(graphs.get(graphId));
    }

    @Override
    public String put(GraphDefinition graph) {
        Objects.requireNonNull(graph, "graph");
        graphs.put(graph.id(), graph);
        return graph.id();
    }

    @Override
    public List<String> ids() {
        return graphs.keySet().stream().sorted().toList();
    }
}
