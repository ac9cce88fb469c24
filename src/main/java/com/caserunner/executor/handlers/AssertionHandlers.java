package com.caserunner.executor.handlers;

import com.caserunner.core.TestCase;
import com.caserunner.executor.AssertionEngine.Aggregator;
import com.caserunner.executor.AssertionEngine.Severity;
import com.caserunner.executor.DirectiveArguments;
import com.caserunner.executor.DirectiveHandler;
import com.caserunner.script.ScriptValues;

// ── assert_contains, assert_contains_any, assert_excludes, ... ────────────────

/**
 * Checks the last call's output for the presence or absence of every
 * positional value. Keywords: {@code message} (custom failure message) and
 * {@code case_sensitive} (default false).
 */
class ContainsHandler implements DirectiveHandler {

    private final Severity   severity;
    private final Aggregator aggregator;
    private final boolean    contains;

    ContainsHandler(Severity severity, Aggregator aggregator, boolean contains) {
        this.severity   = severity;
        this.aggregator = aggregator;
        this.contains   = contains;
    }

    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        Object message = arguments.getKeyword(ArgumentAdapters.KEY_MESSAGE, "");
        boolean caseSensitive = ScriptValues.isTruthy(
            arguments.getKeyword(ArgumentAdapters.KEY_CASE_SENSITIVE, Boolean.FALSE));
        testCase.getAssertions().checkContains(severity, aggregator, contains, caseSensitive,
            message != null ? String.valueOf(message) : "", arguments.getPositional());
        return null;
    }

    @Override
    public String toString() {
        return "ContainsHandler{" + severity + ", " + aggregator + ", contains=" + contains + "}";
    }
}

// ── assert_success / assert_failure ───────────────────────────────────────────

class AssertSuccessHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        testCase.getAssertions().assertSuccess(arguments.getString(0), arguments.rest(1).toArray());
        return null;
    }
}

class AssertFailureHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        testCase.getAssertions().assertFailure(arguments.getString(0), arguments.rest(1).toArray());
        return null;
    }
}

// ── expect / assert_that (code only) ──────────────────────────────────────────

/** {@code expect(condition, message, args...)} or {@code assert_that(...)}. */
class ConditionHandler implements DirectiveHandler {

    private final Severity severity;
    private final String   name;

    ConditionHandler(Severity severity, String name) {
        this.severity = severity;
        this.name     = name;
    }

    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        if (arguments.size() < 1) {
            throw BuiltinDirectives.missing(name, "a condition");
        }
        boolean condition = ScriptValues.isTruthy(arguments.get(0));
        String message = BuiltinDirectives.requireString(arguments, 1, name, "a message");
        testCase.getAssertions().check(severity, condition, message, arguments.rest(2).toArray());
        return null;
    }
}

// ── fail / abort (code only) ──────────────────────────────────────────────────

class FailHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        testCase.getAssertions().fail();
        return null;
    }
}

class AbortHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        testCase.getAssertions().abort();
        return null;
    }
}
