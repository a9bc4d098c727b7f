package com.toolgraph.engine.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable workflow graph: nodes, guarded edges and a start node.
 *
 * Node and edge order is the declaration order and is significant: outgoing
 * edges are tried in that order when the engine picks the next node.
 *
 * Construction does not check referential integrity; GraphValidator does that
 * before a graph is accepted into the GraphStore.
 */
public record GraphDefinition(
        String               id,
        List<NodeDefinition> nodes,
        List<EdgeDefinition> edges,
        String               startNodeId) {

    public GraphDefinition {
        Objects.requireNonNull(id, "id");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public Optional<NodeDefinition> findNode(String nodeId) {
        if (nodeId == null) return Optional.empty();
        return nodes.stream().filter(n -> nodeId.equals(n.id())).findFirst();
    }

    /** Edges leaving {@code nodeId}, in declaration order. */
    public List<EdgeDefinition> outgoingEdges(String nodeId) {
        return edges.stream().filter(e -> nodeId != null && nodeId.equals(e.source())).toList();
    }
}
