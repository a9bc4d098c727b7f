package com.toolgraph.engine.service;

import com.toolgraph.engine.guard.ConditionEvaluator;
import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.GraphDefinition;
import com.toolgraph.engine.model.NodeDefinition;
import com.toolgraph.engine.store.GraphStore;
import com.toolgraph.engine.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GraphService and GraphValidator.
 *
 * GraphStore and ToolRegistry are mocked; validation is real.
 */
@ExtendWith(MockitoExtension.class)
class GraphServiceTest {

    @Mock GraphStore   graphStore;
    @Mock ToolRegistry toolRegistry;

    GraphService service;

    @BeforeEach
    void setUp() {
        service = new GraphService(graphStore, new GraphValidator(new ConditionEvaluator()), toolRegistry);
    }

    private static List<NodeDefinition> nodes(String... ids) {
        return Arrays.stream(ids).map(id -> new NodeDefinition(id, "tool_" + id)).toList();
    }

    // ------------------------------------------------------------------
    // create / register
    // ------------------------------------------------------------------

    @Test
    void create_validGraph_storedUnderGeneratedId() {
        when(toolRegistry.contains(any())).thenReturn(true);

        GraphDefinition graph = service.create(
                nodes("a", "b"), List.of(new EdgeDefinition("a", "b", "state.get('go', True)")), "a");

        ArgumentCaptor<GraphDefinition> captor = ArgumentCaptor.forClass(GraphDefinition.class);
        verify(graphStore).put(captor.capture());
        assertThat(captor.getValue()).isEqualTo(graph);
        assertThat(graph.id()).isNotBlank();
        assertThat(graph.startNodeId()).isEqualTo("a");
    }

    @Test
    void create_twice_generatesDistinctIds() {
        GraphDefinition first  = service.create(nodes("a"), List.of(), "a");
        GraphDefinition second = service.create(nodes("a"), List.of(), "a");

        assertThat(first.id()).isNotEqualTo(second.id());
    }

    @Test
    void register_toolNotRegisteredYet_stillStored() {
        when(toolRegistry.contains("tool_a")).thenReturn(false);

        service.register(new GraphDefinition("late-tools", nodes("a"), List.of(), "a"));

        verify(graphStore).put(any());
    }

    @Test
    void register_invalidGraph_neverStored() {
        GraphDefinition broken = new GraphDefinition("broken", nodes("a"), List.of(), "missing");

        assertThatThrownBy(() -> service.register(broken))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("start node 'missing'");
        verify(graphStore, never()).put(any());
    }

    // ------------------------------------------------------------------
    // Validation rules
    // ------------------------------------------------------------------

    @Test
    void validate_collectsEveryProblem() {
        GraphDefinition graph = new GraphDefinition("g",
                List.of(new NodeDefinition("a", "t"), new NodeDefinition("a", "t"), new NodeDefinition("b", " ")),
                List.of(new EdgeDefinition("a", "ghost"),
                        new EdgeDefinition("nowhere", "b"),
                        new EdgeDefinition("a", "b", "import os")),
                "a");

        assertThatThrownBy(() -> new GraphValidator(new ConditionEvaluator()).validate(graph))
                .isInstanceOfSatisfying(InvalidGraphException.class, e -> assertThat(e.getProblems())
                        .hasSize(5)
                        .anySatisfy(p -> assertThat(p).contains("duplicate node id 'a'"))
                        .anySatisfy(p -> assertThat(p).contains("node 'b' has no toolName"))
                        .anySatisfy(p -> assertThat(p).contains("target 'ghost'"))
                        .anySatisfy(p -> assertThat(p).contains("source 'nowhere'"))
                        .anySatisfy(p -> assertThat(p).contains("invalid condition")));
    }

    @Test
    void validate_emptyGraph_rejected() {
        GraphDefinition graph = new GraphDefinition("empty", List.of(), List.of(), null);

        assertThatThrownBy(() -> new GraphValidator(new ConditionEvaluator()).validate(graph))
                .isInstanceOfSatisfying(InvalidGraphException.class, e -> assertThat(e.getProblems())
                        .contains("graph has no nodes"));
    }

    @Test
    void validate_selfLoopWithoutGuard_accepted() {
        GraphDefinition graph = new GraphDefinition("loop",
                nodes("a"), List.of(new EdgeDefinition("a", "a")), "a");

        new GraphValidator(new ConditionEvaluator()).validate(graph);
    }
}
