package com.caserunner.executor.handlers;

import com.caserunner.core.SymbolTable;
import com.caserunner.core.TestCase;
import com.caserunner.executor.CaseConfigException;
import com.caserunner.executor.DirectiveArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapters turning the argument blocks declared in stage entries into handler
 * arguments. Validation problems are logged at ERROR and thrown as
 * {@link CaseConfigException}.
 */
final class ArgumentAdapters {

    private static final Logger log = LoggerFactory.getLogger(ArgumentAdapters.class);

    static final String KEY_ARGS      = "args";
    static final String KEY_PARAMS    = "params";
    static final String KEY_VARIABLE  = "variable";
    static final String KEY_NAME      = "name";
    static final String KEY_PATTERN   = "pattern";
    static final String KEY_GROUPS    = "groups";
    static final String KEY_MESSAGE   = "message";
    static final String KEY_CASE_SENSITIVE = "case_sensitive";

    private ArgumentAdapters() {}

    // ── call / call_may_fail ──────────────────────────────────────────────────

    /**
     * {@code {<target key>: T, args: [...], params: {...}}} becomes positional
     * {@code [T, args...]} and keyword {@code params}. Arguments and parameters
     * are variable-or-literal entries.
     */
    static DirectiveArguments forCall(TestCase testCase, Object declared) {
        String targetKey = testCase.getCallTargetKey();
        if (!(declared instanceof Map<?, ?> parts) || !parts.containsKey(targetKey)) {
            throw configError(String.format(
                "when calling artifacts, the first parameter must be \"- %s: TARGET\"", targetKey));
        }
        SymbolTable symbols = testCase.getSymbols();
        List<Object> positional = new ArrayList<>();
        positional.add(parts.get(targetKey));
        Map<String, Object> params = new LinkedHashMap<>();

        for (Map.Entry<?, ?> e : parts.entrySet()) {
            Object key = e.getKey();
            if (targetKey.equals(key)) {
                continue;
            }
            if (KEY_ARGS.equals(key)) {
                if (!(e.getValue() instanceof List<?> args)) {
                    throw configError("\"" + KEY_ARGS + "\" must be a list, got " + e.getValue());
                }
                for (Object arg : args) {
                    positional.add(symbols.resolveVariableOrLiteral(arg));
                }
            } else if (KEY_PARAMS.equals(key)) {
                if (!(e.getValue() instanceof Map<?, ?> declaredParams)) {
                    throw configError("\"" + KEY_PARAMS + "\" must be a map, got " + e.getValue());
                }
                declaredParams.forEach((name, value) ->
                    params.put(String.valueOf(name), symbols.resolveVariableOrLiteral(value)));
            } else {
                throw configError("unknown argument to function call \"- " + key + "\"");
            }
        }
        return new DirectiveArguments(positional, params);
    }

    // ── shell / log / assert_success / assert_failure ─────────────────────────

    /**
     * A list whose first element is a message template and whose remaining
     * elements are symbol names or literals, see
     * {@link SymbolTable#lookupLiteralOrVariable}. A bare string is a template
     * without arguments.
     */
    static DirectiveArguments argsString(TestCase testCase, Object declared) {
        if (declared == null) {
            return DirectiveArguments.empty();
        }
        if (declared instanceof List<?> parts) {
            if (parts.isEmpty()) {
                return DirectiveArguments.empty();
            }
            List<Object> positional = new ArrayList<>();
            positional.add(parts.get(0));
            for (Object token : parts.subList(1, parts.size())) {
                positional.add(testCase.getSymbols().lookupLiteralOrVariable(token));
            }
            return new DirectiveArguments(positional, null);
        }
        if (declared instanceof Map<?, ?>) {
            throw configError("expected a message and its arguments as a list, got " + declared);
        }
        return DirectiveArguments.of(declared);
    }

    // ── uuid / env ────────────────────────────────────────────────────────────

    /** Binds a fresh UUID to the declared variable name. */
    static DirectiveArguments forUuid(TestCase testCase, Object declared) {
        if (declared == null || declared instanceof Map<?, ?> || declared instanceof List<?>
                || String.valueOf(declared).isEmpty()) {
            throw configError("uuid needs the name of the variable to set, got " + declared);
        }
        testCase.getSymbols().set(String.valueOf(declared), UuidHandler.newUuid());
        return DirectiveArguments.declarativeOnly();
    }

    /** {@code {variable: v, name: ENV_VAR}} binds the environment variable's value to {@code v}. */
    static DirectiveArguments forEnv(TestCase testCase, Object declared) {
        if (!(declared instanceof Map<?, ?> parts)
                || !parts.containsKey(KEY_VARIABLE) || !parts.containsKey(KEY_NAME)) {
            throw configError(String.format("need both \"%s\" and \"%s\"", KEY_NAME, KEY_VARIABLE));
        }
        String variable = String.valueOf(parts.get(KEY_VARIABLE));
        String name     = String.valueOf(parts.get(KEY_NAME));
        testCase.getSymbols().set(variable, testCase.getEnvironmentVariable(name));
        return DirectiveArguments.declarativeOnly();
    }

    // ── extract_match ─────────────────────────────────────────────────────────

    /** {@code {pattern: p, variable: v}} or {@code {pattern: p, groups: [a, b]}}. */
    static DirectiveArguments forExtractMatch(TestCase testCase, Object declared) {
        if (!(declared instanceof Map<?, ?> parts)) {
            throw configError("extract_match needs a map with \"" + KEY_PATTERN + "\", got " + declared);
        }
        List<Object> positional = new ArrayList<>();
        positional.add(parts.get(KEY_PATTERN));
        Map<String, Object> keyword = new LinkedHashMap<>();
        if (parts.containsKey(KEY_VARIABLE)) keyword.put(KEY_VARIABLE, parts.get(KEY_VARIABLE));
        if (parts.containsKey(KEY_GROUPS))   keyword.put(KEY_GROUPS, parts.get(KEY_GROUPS));
        return new DirectiveArguments(positional, keyword);
    }

    // ── assert_contains and friends ───────────────────────────────────────────

    /**
     * A list of variable-or-literal entries, optionally preceded by a map
     * holding {@code message} and/or {@code case_sensitive}. Matching is
     * case-insensitive unless that map says otherwise.
     */
    static DirectiveArguments forContains(TestCase testCase, Object declared) {
        if (declared == null) {
            declared = List.of();
        }
        if (!(declared instanceof List<?> parts)) {
            throw configError("expected a list of values to look for, got " + declared);
        }
        Map<String, Object> keyword = new LinkedHashMap<>();
        keyword.put(KEY_MESSAGE, "");
        keyword.put(KEY_CASE_SENSITIVE, Boolean.FALSE);

        int start = 0;
        if (!parts.isEmpty() && parts.get(0) instanceof Map<?, ?> first
                && (first.containsKey(KEY_MESSAGE) || first.containsKey(KEY_CASE_SENSITIVE))) {
            for (Map.Entry<?, ?> e : first.entrySet()) {
                if (KEY_MESSAGE.equals(e.getKey())) {
                    keyword.put(KEY_MESSAGE, e.getValue() != null ? String.valueOf(e.getValue()) : "");
                } else if (KEY_CASE_SENSITIVE.equals(e.getKey())) {
                    keyword.put(KEY_CASE_SENSITIVE, Boolean.valueOf(String.valueOf(e.getValue())));
                } else {
                    throw configError("unexpected option \"" + e.getKey() + "\" next to \"" + KEY_MESSAGE + "\"");
                }
            }
            start = 1;
        }

        List<Object> values = new ArrayList<>();
        for (Object entry : parts.subList(start, parts.size())) {
            values.add(testCase.getSymbols().resolveVariableOrLiteral(entry));
        }
        return new DirectiveArguments(values, keyword);
    }

    // ── code ──────────────────────────────────────────────────────────────────

    /** The declared value is the only positional argument. */
    static DirectiveArguments single(TestCase testCase, Object declared) {
        return DirectiveArguments.of(declared);
    }

    private static CaseConfigException configError(String message) {
        log.error("ArgumentAdapters: {}", message);
        return new CaseConfigException(message);
    }
}
