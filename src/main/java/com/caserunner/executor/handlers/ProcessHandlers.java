package com.caserunner.executor.handlers;

import com.caserunner.core.TestCase;
import com.caserunner.executor.CallResult;
import com.caserunner.executor.DirectiveArguments;
import com.caserunner.executor.DirectiveHandler;

// ── call ──────────────────────────────────────────────────────────────────────

/**
 * Runs a named call target and requires it to succeed. Positional arguments
 * are the target followed by its arguments; keywords are its parameters.
 * Returns the captured output.
 */
class CallHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        String target = BuiltinDirectives.requireString(arguments, 0, "call", "a target");
        CallResult result = testCase.getInvoker()
            .callAllowError(target, arguments.rest(1), arguments.getKeyword());
        testCase.getAssertions().assertThat(result.isSuccess(), "call failed: \"{}\"", arguments.getPositional());
        return result.getOutput();
    }
}

// ── call_may_fail ─────────────────────────────────────────────────────────────

/** Like {@code call} but any exit code is accepted. Returns {@code [exitCode, output]}. */
class CallMayFailHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        String target = BuiltinDirectives.requireString(arguments, 0, "call_may_fail", "a target");
        return testCase.getInvoker()
            .callAllowError(target, arguments.rest(1), arguments.getKeyword())
            .asList();
    }
}

// ── shell ─────────────────────────────────────────────────────────────────────

/** Runs a literal command line. Returns {@code [exitCode, output]}. */
class ShellHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        String template = BuiltinDirectives.requireString(arguments, 0, "shell", "a command");
        return testCase.getInvoker().shell(template, arguments.rest(1)).asList();
    }
}
