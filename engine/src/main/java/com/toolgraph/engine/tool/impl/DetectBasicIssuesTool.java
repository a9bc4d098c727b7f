package com.toolgraph.engine.tool.impl;

import com.toolgraph.engine.tool.BuiltinTool;
import com.toolgraph.engine.tool.ImmediateTool;
import com.toolgraph.engine.tool.ToolManifest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Simple style and formatting checks on {@code state.code}:
 *   - tab characters
 *   - trailing whitespace at the end of the file
 *   - {@code print(} calls in code that never mentions {@code logging}
 *
 * Writes: {@code issues} (messages), {@code issue_count}.
 */
@Component
public class DetectBasicIssuesTool extends ImmediateTool implements BuiltinTool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "detect_basic_issues", "1.0.0",
            "Read 'code'; write 'issues' and 'issue_count' for tabs, trailing whitespace and print calls.");

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    protected Map<String, Object> execute(Map<String, Object> state) {
        String code = CodeReviewSupport.code(state);
        List<String> issues = new ArrayList<>();

        if (code.contains("\t")) {
            issues.add("Contains tab characters; prefer spaces.");
        }
        if (code.endsWith(" ")) {
            issues.add("File ends with trailing whitespace.");
        }
        if (code.contains("print(") && !code.contains("logging")) {
            issues.add("Uses print statements; consider using logging.");
        }

        return Map.of(
                "issues", issues,
                "issue_count", issues.size());
    }
}
