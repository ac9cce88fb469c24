package com.caserunner.executor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat call arguments of a directive: positional values plus named keywords.
 *
 * Produced either by an {@link ArgumentAdapter} from a declared argument block,
 * or directly by a call inside embedded code.
 */
public class DirectiveArguments {

    private static final DirectiveArguments DECLARATIVE_ONLY =
        new DirectiveArguments(Collections.emptyList(), Collections.emptyMap(), true);

    private final List<Object>        positional;
    private final Map<String, Object> keyword;
    private final boolean             declarativeOnly;

    private DirectiveArguments(List<Object> positional, Map<String, Object> keyword, boolean declarativeOnly) {
        this.positional      = positional;
        this.keyword         = keyword;
        this.declarativeOnly = declarativeOnly;
    }

    public DirectiveArguments(List<?> positional, Map<String, ?> keyword) {
        this(positional != null ? Collections.unmodifiableList(new ArrayList<>(positional)) : Collections.emptyList(),
             keyword != null ? Collections.unmodifiableMap(new LinkedHashMap<>(keyword)) : Collections.emptyMap(),
             false);
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static DirectiveArguments of(Object... positional) {
        return new DirectiveArguments(Arrays.asList(positional), null);
    }

    public static DirectiveArguments empty() {
        return new DirectiveArguments(null, null);
    }

    /** The adapter already did the work; the handler must not be called. */
    public static DirectiveArguments declarativeOnly() {
        return DECLARATIVE_ONLY;
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public boolean isDeclarativeOnly() { return declarativeOnly; }

    public List<Object> getPositional() { return positional; }

    public Map<String, Object> getKeyword() { return keyword; }

    public int size() { return positional.size(); }

    /** Positional argument {@code index}, or {@code null} if not supplied. */
    public Object get(int index) {
        return index < positional.size() ? positional.get(index) : null;
    }

    /** Positional argument {@code index} as a string, or {@code null} if not supplied. */
    public String getString(int index) {
        Object val = get(index);
        return val != null ? val.toString() : null;
    }

    /** Positional arguments from {@code from} to the end. */
    public List<Object> rest(int from) {
        return from < positional.size() ? positional.subList(from, positional.size()) : Collections.emptyList();
    }

    public boolean hasKeyword(String name) {
        return keyword.containsKey(name);
    }

    /** Keyword {@code name}, or {@code defaultValue} if not supplied. */
    public Object getKeyword(String name, Object defaultValue) {
        return keyword.containsKey(name) ? keyword.get(name) : defaultValue;
    }

    /**
     * Keyword {@code name} if supplied, else positional argument {@code index}.
     * Lets code call a directive either way, e.g. {@code extract_match(p, variable='n')}.
     */
    public Object getEither(String name, int index) {
        return keyword.containsKey(name) ? keyword.get(name) : get(index);
    }

    @Override
    public String toString() {
        return declarativeOnly
            ? "DirectiveArguments{declarativeOnly}"
            : String.format("DirectiveArguments{positional=%s, keyword=%s}", positional, keyword);
    }
}
