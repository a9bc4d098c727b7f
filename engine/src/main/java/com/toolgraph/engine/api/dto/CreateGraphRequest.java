package com.toolgraph.engine.api.dto;

import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.NodeDefinition;

import java.util.List;

/**
 * Request body for POST /graph/create.
 *
 * Example:
 * <pre>
 *   {"nodes": [{"id": "a", "toolName": "extract_functions"}],
 *    "edges": [],
 *    "startNodeId": "a"}
 * </pre>
 */
public record CreateGraphRequest(List<NodeDefinition> nodes,
                                 List<EdgeDefinition> edges,
                                 String startNodeId) {}
