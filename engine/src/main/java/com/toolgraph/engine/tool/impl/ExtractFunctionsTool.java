package com.toolgraph.engine.tool.impl;

import com.toolgraph.engine.tool.BuiltinTool;
import com.toolgraph.engine.tool.ImmediateTool;
import com.toolgraph.engine.tool.ToolManifest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds Python-style function definitions ({@code def name(}) in {@code state.code}.
 *
 * Writes: {@code functions} (names in source order), {@code function_count}.
 */
@Component
public class ExtractFunctionsTool extends ImmediateTool implements BuiltinTool {

    private static final Pattern FUNCTION_DEF = Pattern.compile("def\\s+(\\w+)\\s*\\(");

    private static final ToolManifest MANIFEST = new ToolManifest(
            "extract_functions", "1.0.0",
            "Read 'code'; write 'functions' and 'function_count'.");

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    protected Map<String, Object> execute(Map<String, Object> state) {
        String code = CodeReviewSupport.code(state);
        List<String> functions = new ArrayList<>();
        Matcher m = FUNCTION_DEF.matcher(code);
        while (m.find()) {
            functions.add(m.group(1));
        }
        return Map.of(
                "functions", functions,
                "function_count", functions.size());
    }
}
