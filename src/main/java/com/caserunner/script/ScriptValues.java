package com.caserunner.script;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Value semantics shared by the script interpreter and directive handlers.
 *
 * Scripts work with {@code null}, {@link Boolean}, {@link Long}, {@link Double},
 * {@link String}, {@link List} and {@link Map}; other {@link Number} types
 * coming from handlers are treated like their long or double value.
 */
public final class ScriptValues {

    private ScriptValues() {}

    /** null, false, zero, "" and empty collections are false; everything else is true. */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return isIntegral(n) ? n.longValue() != 0 : n.doubleValue() != 0.0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    /** Equality with numbers compared by value, so {@code 1 == 1.0}. */
    public static boolean areEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) return x.longValue() == y.longValue();
            return x.doubleValue() == y.doubleValue();
        }
        return a == null ? b == null : a.equals(b);
    }

    public static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) return Long.compare(x.longValue(), y.longValue());
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        throw new ScriptException("cannot compare " + typeName(a) + " with " + typeName(b));
    }

    /** {@code needle in haystack} for strings, lists and maps. */
    public static boolean contains(Object haystack, Object needle) {
        if (haystack instanceof String s) {
            return s.contains(toText(needle));
        }
        if (haystack instanceof Collection<?> c) {
            for (Object item : c) {
                if (areEqual(item, needle)) return true;
            }
            return false;
        }
        if (haystack instanceof Map<?, ?> m) {
            return m.containsKey(needle);
        }
        throw new ScriptException("'in' needs a string, list or map on the right, got " + typeName(haystack));
    }

    /** Text form used by string concatenation. */
    public static String toText(Object value) {
        return String.valueOf(value);
    }

    public static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number n) return isIntegral(n) ? "integer" : "number";
        if (value instanceof List<?>) return "list";
        if (value instanceof Map<?, ?>) return "map";
        if (value instanceof ScriptFunction) return "function";
        return value.getClass().getSimpleName();
    }
}
