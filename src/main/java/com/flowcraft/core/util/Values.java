package com.flowcraft.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Helpers for the open, JSON-like value maps carried by nodes, edges and
 * flows.
 *
 * <p>
 * Values are plain Java objects: {@link String}, {@link Number},
 * {@link Boolean}, {@link List}, {@link Map} or {@code null}.
 */
public final class Values {
    private Values() {
        // Utility class
    }

    /**
     * Whether a field counts as "set": present, and not an empty string,
     * empty container, {@code false} or numeric zero.
     */
    public static boolean isSet(Object value) {
        if (value == null)
            return false;
        if (value instanceof String s)
            return !s.isEmpty();
        if (value instanceof Boolean b)
            return b;
        if (value instanceof Collection<?> c)
            return !c.isEmpty();
        if (value instanceof Map<?, ?> m)
            return !m.isEmpty();
        if (value instanceof Number n)
            return n.doubleValue() != 0.0;
        return true;
    }

    /** Returns the value as a string-keyed map, or an empty map if it is not one. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Collections.emptyMap();
    }

    /** Returns the elements of a collection value as strings, or an empty list. */
    public static List<String> asStringList(Object value) {
        if (!(value instanceof Collection<?> c))
            return Collections.emptyList();
        List<String> out = new ArrayList<>(c.size());
        for (Object o : c)
            out.add(String.valueOf(o));
        return out;
    }

    /**
     * Copies a map with its keys sorted lexicographically, recursing into
     * nested maps and lists so the whole value has a stable order.
     */
    public static Map<String, Object> sortedCopy(Map<String, Object> map) {
        Map<String, Object> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : new TreeMap<>(map).entrySet())
            sorted.put(e.getKey(), sortedValue(e.getValue()));
        return sorted;
    }

    private static Object sortedValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> asStrings = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet())
                asStrings.put(String.valueOf(e.getKey()), e.getValue());
            return sortedCopy(asStrings);
        }
        if (value instanceof Collection<?> c) {
            List<Object> out = new ArrayList<>(c.size());
            for (Object o : c)
                out.add(sortedValue(o));
            return out;
        }
        return value;
    }

    /**
     * Immutable, insertion-ordered deep copy that tolerates {@code null}
     * values. Nested maps and lists are copied and frozen as well.
     */
    public static Map<String, Object> frozenCopy(Map<String, Object> map) {
        if (map == null || map.isEmpty())
            return Collections.emptyMap();
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : map.entrySet())
            copy.put(e.getKey(), frozenValue(e.getValue()));
        return Collections.unmodifiableMap(copy);
    }

    private static Object frozenValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet())
                copy.put(e.getKey(), frozenValue(e.getValue()));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> c) {
            List<Object> copy = new ArrayList<>(c.size());
            for (Object o : c)
                copy.add(frozenValue(o));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
