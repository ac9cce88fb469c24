package com.caserunner.executor.handlers;

import com.caserunner.executor.AssertionEngine.Aggregator;
import com.caserunner.executor.AssertionEngine.Severity;
import com.caserunner.executor.CaseConfigException;
import com.caserunner.executor.DirectiveArguments;
import com.caserunner.executor.DirectiveTable;
import com.caserunner.executor.ProcessInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the built-in directives of every case.
 *
 * <pre>
 *   Values         testcase_num, testcase_id, _last_call_output
 *   Processes      call, call_may_fail, shell
 *   Utilities      uuid, env, log, extract_match, code
 *   Code only      fail, expect, abort, assert_that
 *   Output checks  assert_contains, assert_contains_any, assert_excludes,
 *                  assert_not_contains, assert_excludes_any,
 *                  assert_success, assert_failure
 * </pre>
 *
 * Only the assertion severity of the output checks is exposed; their
 * expectation counterparts are reachable through {@code expect} in code.
 */
public final class BuiltinDirectives {

    private static final Logger log = LoggerFactory.getLogger(BuiltinDirectives.class);

    public static final String TESTCASE_NUM = "testcase_num";
    public static final String TESTCASE_ID  = "testcase_id";

    private BuiltinDirectives() {}

    public static void registerAll(DirectiveTable table, int index, String label) {
        // ── Values ──
        table.registerValue(TESTCASE_NUM, index);
        table.registerValue(TESTCASE_ID, label);
        table.registerValue(ProcessInvoker.LAST_CALL_OUTPUT, "");

        // ── Processes ──
        table.register("call",          new CallHandler(),        ArgumentAdapters::forCall);
        table.register("call_may_fail", new CallMayFailHandler(), ArgumentAdapters::forCall);
        table.register("shell",         new ShellHandler(),       ArgumentAdapters::argsString);

        // ── Utilities ──
        table.register("uuid",          new UuidHandler(),         ArgumentAdapters::forUuid);
        table.register("env",           new EnvHandler(),          ArgumentAdapters::forEnv);
        table.register("log",           new LogHandler(),          ArgumentAdapters::argsString);
        table.register("extract_match", new ExtractMatchHandler(), ArgumentAdapters::forExtractMatch);
        table.register("code",          new CodeHandler(),         ArgumentAdapters::single);

        // ── Code only ──
        table.register("fail",        new FailHandler(),                                  null);
        table.register("expect",      new ConditionHandler(Severity.EXPECT, "expect"),      null);
        table.register("abort",       new AbortHandler(),                                 null);
        table.register("assert_that", new ConditionHandler(Severity.ASSERT, "assert_that"), null);

        // ── Output checks ──
        table.register("assert_contains_any",
            new ContainsHandler(Severity.ASSERT, Aggregator.ANY, true),  ArgumentAdapters::forContains);
        table.register("assert_excludes",
            new ContainsHandler(Severity.ASSERT, Aggregator.ALL, false), ArgumentAdapters::forContains);
        table.register("assert_not_contains",
            new ContainsHandler(Severity.ASSERT, Aggregator.ALL, false), ArgumentAdapters::forContains);
        table.register("assert_contains",
            new ContainsHandler(Severity.ASSERT, Aggregator.ALL, true),  ArgumentAdapters::forContains);
        table.register("assert_excludes_any",
            new ContainsHandler(Severity.ASSERT, Aggregator.ANY, false), ArgumentAdapters::forContains);
        table.register("assert_success", new AssertSuccessHandler(), ArgumentAdapters::argsString);
        table.register("assert_failure", new AssertFailureHandler(), ArgumentAdapters::argsString);

        log.debug("BuiltinDirectives: {} directive(s) registered for case {}", table.size(), index);
    }

    // ── Argument helpers for handlers ─────────────────────────────────────────

    static String requireString(DirectiveArguments arguments, int index, String directive, String what) {
        Object value = arguments.get(index);
        if (value == null) {
            throw missing(directive, what);
        }
        return String.valueOf(value);
    }

    static CaseConfigException missing(String directive, String what) {
        String message = directive + " needs " + what;
        log.error("BuiltinDirectives: {}", message);
        return new CaseConfigException(message);
    }
}
