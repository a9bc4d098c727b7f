package com.toolgraph.engine.tool;

import com.toolgraph.engine.model.StateCopier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * In-process tool registry.
 *
 * Every {@link BuiltinTool} bean is collected at startup via constructor
 * injection; further tools can be added at runtime with {@link #register}.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name ({@link #get}).</li>
 *   <li>Uniform invocation ({@link #run}): immediate and suspending tools are
 *       both awaited here, bounded by the configured timeout, and their result
 *       is checked before it reaches the engine.</li>
 *   <li>Metrics: every call is timed and counted.</li>
 * </ol>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;
    private final Duration      timeout;

    public ToolRegistry(List<BuiltinTool> builtinTools,
                        MeterRegistry meterRegistry,
                        @Value("${toolgraph.tool.timeout-seconds:60}") long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("toolgraph.tool.timeout-seconds must be positive");
        }
        this.meterRegistry = meterRegistry;
        this.timeout       = Duration.ofSeconds(timeoutSeconds);
        for (BuiltinTool tool : builtinTools) {
            tools.put(tool.manifest().name(), tool);
            log.info("Registered tool '{}' v{} [{}]",
                    tool.manifest().name(), tool.manifest().version(), tool.mode());
        }
    }

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    /** Store {@code tool} under {@code name}, replacing any previous registration. */
    public void register(String name, Tool tool) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        Objects.requireNonNull(tool, "tool");
        Tool previous = tools.put(name, tool);
        if (previous != null) {
            log.info("Replaced tool '{}' [{}]", name, tool.mode());
        } else {
            log.info("Registered tool '{}' [{}]", name, tool.mode());
        }
    }

    public Tool get(String name) {
        Tool tool = name == null ? null : tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /** Returns all registered tool names (sorted). */
    public List<String> toolNames() {
        return tools.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented invocation
    // ------------------------------------------------------------------

    /**
     * Invoke a named tool and wait for its state update.
     *
     * The tool sees an unmodifiable deep copy of {@code state}; the caller's
     * map is never exposed. Every call is timed and counted:
     * <pre>
     *   toolgraph.tool.calls{tool, status="success|execution_error|timeout|invalid_result|interrupted"}
     *   toolgraph.tool.duration{tool, mode="immediate|suspending"}
     * </pre>
     *
     * @throws ToolNotFoundException if no tool is registered under {@code toolName}
     * @throws ToolException         if the tool fails, times out or returns no map
     */
    public Map<String, Object> run(String toolName, Map<String, ?> state) {
        Tool tool = get(toolName);
        String modeTag = tool.mode().name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        CompletableFuture<?> future = null;
        try {
            future = tool.run(StateCopier.freeze(state)).toCompletableFuture();
            Object result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return checkResult(toolName, result);
        } catch (ToolException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (TimeoutException e) {
            status = "timeout";
            future.cancel(true);
            throw new ToolException(toolName, ToolException.Kind.TIMEOUT,
                    "Tool '" + toolName + "' did not finish within " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = "interrupted";
            throw new ToolException(toolName, ToolException.Kind.INTERRUPTED,
                    "Interrupted while waiting for tool '" + toolName + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ToolException te) {
                status = te.getKind().name().toLowerCase();
                throw te;
            }
            status = "execution_error";
            throw new ToolException(toolName, ToolException.Kind.EXECUTION_ERROR,
                    "Tool '" + toolName + "' failed: " + cause.getMessage(), cause);
        } catch (VirtualMachineError e) {
            status = "execution_error";
            throw e;
        } catch (RuntimeException | Error e) {
            status = "execution_error";
            throw new ToolException(toolName, ToolException.Kind.EXECUTION_ERROR,
                    "Tool '" + toolName + "' failed: " + e, e);
        } finally {
            sample.stop(meterRegistry.timer("toolgraph.tool.duration",
                    "tool", toolName, "mode", modeTag));
            meterRegistry.counter("toolgraph.tool.calls",
                    "tool", toolName, "status", status).increment();
        }
    }

    /**
     * Generic signatures do not survive erasure, so a tool can still hand back
     * something other than a string-keyed map. Anything else is rejected here.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> checkResult(String toolName, Object result) {
        if (!(result instanceof Map<?, ?> map)) {
            throw new ToolException(toolName, ToolException.Kind.INVALID_RESULT,
                    "Tool '" + toolName + "' must return a map to merge into state, got "
                            + (result == null ? "null" : result.getClass().getSimpleName()));
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new ToolException(toolName, ToolException.Kind.INVALID_RESULT,
                        "Tool '" + toolName + "' returned a non-string key: " + key);
            }
        }
        return (Map<String, Object>) map;
    }
}
