package com.toolgraph.engine.tool;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Tool that computes its result synchronously on the calling thread.
 *
 * Subclasses implement {@link #execute}; ad-hoc tools can be built from a
 * lambda with {@link #of}.
 */
public abstract class ImmediateTool implements Tool {

    public static ImmediateTool of(Function<Map<String, Object>, Map<String, Object>> fn) {
        return new ImmediateTool() {
            @Override
            protected Map<String, Object> execute(Map<String, Object> state) {
                return fn.apply(state);
            }
        };
    }

    @Override
    public final ToolMode mode() {
        return ToolMode.IMMEDIATE;
    }

    @Override
    public final CompletionStage<Map<String, Object>> run(Map<String, Object> state) {
        try {
            return CompletableFuture.completedFuture(execute(state));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract Map<String, Object> execute(Map<String, Object> state) throws Exception;
}
