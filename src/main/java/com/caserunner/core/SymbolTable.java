package com.caserunner.core;

import com.caserunner.executor.CaseConfigException;
import com.caserunner.script.ScriptBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names visible to directives and embedded code for the lifetime of one case.
 *
 * Seeded with every directive name at construction, then written by
 * {@code extract_match}, {@code env}, {@code uuid} and assignments inside
 * {@code code}. Last write wins. A name bound to {@code null} is still
 * {@linkplain #contains present}.
 */
public class SymbolTable implements ScriptBindings {

    private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

    public static final String KEY_VARIABLE = "variable";
    public static final String KEY_LITERAL  = "literal";

    private final Map<String, Object> symbols = new LinkedHashMap<>();

    @Override
    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    @Override
    public Object get(String name) {
        return symbols.get(name);
    }

    @Override
    public void set(String name, Object value) {
        symbols.put(name, value);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(symbols.keySet());
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(symbols);
    }

    // ── Declarative argument resolution ───────────────────────────────────────

    /**
     * Returns the value of {@code token} if it names a symbol, otherwise the
     * token itself wrapped in double quotes.
     */
    public Object lookupLiteralOrVariable(Object token) {
        String name = String.valueOf(token);
        if (symbols.containsKey(name)) {
            return symbols.get(name);
        }
        return "\"" + name + "\"";
    }

    /**
     * Resolves one {@code {variable: name}} or {@code {literal: value}} entry
     * from a declared argument block.
     *
     * @throws CaseConfigException if the entry is not a single-key map of one
     *         of those two kinds, or names an unknown variable
     */
    public Object resolveVariableOrLiteral(Object entry) {
        if (!(entry instanceof Map<?, ?> map)) {
            throw configError(String.format(
                "expected a map with one of \"%s\", \"%s\", got %s", KEY_VARIABLE, KEY_LITERAL, entry));
        }
        if (map.size() != 1) {
            throw configError(String.format(
                "expected each element to contain only one of \"%s\", \"%s\", but got %s",
                KEY_VARIABLE, KEY_LITERAL, map));
        }
        Map.Entry<?, ?> only = map.entrySet().iterator().next();
        Object kind  = only.getKey();
        Object value = only.getValue();
        if (KEY_LITERAL.equals(kind)) {
            return value;
        }
        if (KEY_VARIABLE.equals(kind)) {
            String name = String.valueOf(value);
            if (!symbols.containsKey(name)) {
                throw configError("unknown variable \"" + name + "\"");
            }
            return symbols.get(name);
        }
        throw configError(String.format(
            "expected \"%s\" or \"%s\", got \"%s\": \"%s\"", KEY_VARIABLE, KEY_LITERAL, kind, value));
    }

    private static CaseConfigException configError(String message) {
        log.error("SymbolTable: {}", message);
        return new CaseConfigException(message);
    }

    @Override
    public String toString() {
        return "SymbolTable" + symbols.keySet();
    }
}
