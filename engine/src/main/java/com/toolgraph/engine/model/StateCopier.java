package com.toolgraph.engine.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deep copies of run state.
 *
 * Maps, lists, sets and arrays are copied recursively; every other value
 * (strings, numbers, booleans, null, arbitrary objects) is treated as an
 * immutable leaf and shared.
 */
public final class StateCopier {

    private StateCopier() {}

    /** Mutable deep copy, insertion order preserved. */
    public static Map<String, Object> copy(Map<String, ?> state) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (state == null) return out;
        state.forEach((k, v) -> out.put(k, copyValue(v, false)));
        return out;
    }

    /** Deep copy whose containers are all unmodifiable. */
    public static Map<String, Object> freeze(Map<String, ?> state) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (state != null) {
            state.forEach((k, v) -> out.put(k, copyValue(v, true)));
        }
        return Collections.unmodifiableMap(out);
    }

    private static Object copyValue(Object value, boolean frozen) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(k, copyValue(v, frozen)));
            return frozen ? Collections.unmodifiableMap(out) : out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object v : list) out.add(copyValue(v, frozen));
            return frozen ? Collections.unmodifiableList(out) : out;
        }
        if (value instanceof Set<?> set) {
            Set<Object> out = new LinkedHashSet<>();
            for (Object v : set) out.add(copyValue(v, frozen));
            return frozen ? Collections.unmodifiableSet(out) : out;
        }
        if (value != null && value.getClass().isArray()) {
            // Arrays become lists so that frozen snapshots stay read-only.
            int len = Array.getLength(value);
            List<Object> out = new ArrayList<>(len);
            for (int i = 0; i < len; i++) out.add(copyValue(Array.get(value, i), frozen));
            return frozen ? Collections.unmodifiableList(out) : out;
        }
        return value;
    }
}
