package com.toolgraph.engine.tool.impl;

import java.util.Map;

/** Shared state accessors for the code-review tools. */
final class CodeReviewSupport {

    private CodeReviewSupport() {}

    static String code(Map<String, Object> state) {
        Object code = state.get("code");
        return code == null ? "" : code.toString();
    }

    /** Integer view of a numeric state value; missing or non-numeric reads as 0. */
    static int intValue(Map<String, Object> state, String key) {
        Object value = state.get(key);
        return value instanceof Number n ? n.intValue() : 0;
    }

    static int countOccurrences(String haystack, String needle) {
        int count = 0;
        int idx = haystack.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = haystack.indexOf(needle, idx + needle.length());
        }
        return count;
    }
}
