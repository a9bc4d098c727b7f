package com.toolgraph.engine.tool;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Tool whose result arrives later, e.g. after a remote call.
 *
 * Subclasses implement {@link #start}. {@link #of(Function)} adapts a function
 * that already returns a stage; {@link #onExecutor} moves a blocking function
 * onto the given executor.
 */
public abstract class SuspendingTool implements Tool {

    public static SuspendingTool of(
            Function<Map<String, Object>, ? extends CompletionStage<Map<String, Object>>> fn) {
        return new SuspendingTool() {
            @Override
            protected CompletionStage<Map<String, Object>> start(Map<String, Object> state) {
                return fn.apply(state);
            }
        };
    }

    public static SuspendingTool onExecutor(
            Function<Map<String, Object>, Map<String, Object>> fn, Executor executor) {
        return of(state -> CompletableFuture.supplyAsync(() -> fn.apply(state), executor));
    }

    @Override
    public final ToolMode mode() {
        return ToolMode.SUSPENDING;
    }

    @Override
    public final CompletionStage<Map<String, Object>> run(Map<String, Object> state) {
        try {
            CompletionStage<Map<String, Object>> stage = start(state);
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract CompletionStage<Map<String, Object>> start(Map<String, Object> state);
}
