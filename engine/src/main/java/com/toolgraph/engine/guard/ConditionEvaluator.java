package com.toolgraph.engine.guard;

import com.toolgraph.engine.model.EdgeDefinition;
import com.toolgraph.engine.model.StateCopier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the edge a run follows after a node has executed.
 *
 * Candidates are tried strictly in declaration order. The first edge that is
 * either unconditional or whose guard evaluates truthy wins. A guard that does
 * not parse or fails during evaluation counts as false for that edge only;
 * evaluation moves on to the next candidate and the run is never aborted.
 *
 * Guards are compiled once per distinct source string and cached.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final Map<String, Guard> compiled = new ConcurrentHashMap<>();

    /**
     * @param edges outgoing edges of the current node, in declaration order
     * @param state post-merge run state; guards get a read-only copy
     * @return the edge to follow, or empty if the run should complete
     */
    public Optional<EdgeDefinition> selectNext(List<EdgeDefinition> edges, Map<String, ?> state) {
        if (edges == null || edges.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> view = StateCopier.freeze(state);
        for (EdgeDefinition edge : edges) {
            if (edge.isUnconditional()) {
                return Optional.of(edge);
            }
            if (matches(edge, view)) {
                return Optional.of(edge);
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluate one edge's guard. Unconditional edges always match.
     * Errors are reported as a non-match.
     */
    public boolean matches(EdgeDefinition edge, Map<String, Object> state) {
        if (edge.isUnconditional()) {
            return true;
        }
        try {
            return compile(edge.condition()).test(state);
        } catch (GuardSyntaxException | GuardEvaluationException e) {
            log.debug("Skipping edge {} -> {}: guard '{}' could not be evaluated: {}",
                    edge.source(), edge.target(), edge.condition(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Skipping edge {} -> {}: unexpected error in guard '{}'",
                    edge.source(), edge.target(), edge.condition(), e);
            return false;
        }
    }

    /**
     * Compile {@code source}, reusing an earlier compilation when possible.
     *
     * @throws GuardSyntaxException if the source is not a valid guard
     */
    public Guard compile(String source) {
        Guard guard = compiled.get(source);
        if (guard == null) {
            guard = Guard.compile(source);
            compiled.putIfAbsent(source, guard);
        }
        return guard;
    }
}
