package com.toolgraph.engine.tool.impl;

import com.toolgraph.engine.tool.BuiltinTool;
import com.toolgraph.engine.tool.ImmediateTool;
import com.toolgraph.engine.tool.ToolManifest;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Crude complexity heuristic: number of {@code if }, {@code for } and
 * {@code while } occurrences in {@code state.code}.
 *
 * Writes: {@code complexity_score}.
 */
@Component
public class CheckComplexityTool extends ImmediateTool implements BuiltinTool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "check_complexity", "1.0.0",
            "Read 'code'; write 'complexity_score' (count of branch and loop keywords).");

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    protected Map<String, Object> execute(Map<String, Object> state) {
        String code = CodeReviewSupport.code(state);
        int complexity = CodeReviewSupport.countOccurrences(code, "if ")
                + CodeReviewSupport.countOccurrences(code, "for ")
                + CodeReviewSupport.countOccurrences(code, "while ");
        return Map.of("complexity_score", complexity);
    }
}
