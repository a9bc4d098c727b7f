package com.toolgraph.engine.tool.impl;

import com.toolgraph.engine.tool.BuiltinTool;
import com.toolgraph.engine.tool.ImmediateTool;
import com.toolgraph.engine.tool.ToolManifest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the earlier review results into suggestions and a quality score.
 *
 * {@code quality_score = max(0, 100 - 5 * complexity_score - 10 * issue_count)};
 * higher is better. The example graph compares it with {@code state.threshold}.
 *
 * Writes: {@code suggestions}, {@code quality_score}.
 */
@Component
public class SuggestImprovementsTool extends ImmediateTool implements BuiltinTool {

    /** complexity_score above which splitting logic is suggested. */
    private static final int COMPLEXITY_LIMIT = 10;

    private static final ToolManifest MANIFEST = new ToolManifest(
            "suggest_improvements", "1.0.0",
            "Read 'complexity_score', 'issue_count', 'function_count'; write 'suggestions' and 'quality_score'.");

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    protected Map<String, Object> execute(Map<String, Object> state) {
        int complexity    = CodeReviewSupport.intValue(state, "complexity_score");
        int issueCount    = CodeReviewSupport.intValue(state, "issue_count");
        int functionCount = CodeReviewSupport.intValue(state, "function_count");

        List<String> suggestions = new ArrayList<>();
        if (complexity > COMPLEXITY_LIMIT) {
            suggestions.add("Break complex logic into smaller functions.");
        }
        if (issueCount > 0) {
            suggestions.add("Address the reported style/formatting issues.");
        }
        if (functionCount == 0) {
            suggestions.add("Consider structuring code into separate functions.");
        }

        int qualityScore = Math.max(0, 100 - complexity * 5 - issueCount * 10);

        return Map.of(
                "suggestions", suggestions,
                "quality_score", qualityScore);
    }
}
