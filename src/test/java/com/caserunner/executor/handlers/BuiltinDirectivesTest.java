package com.caserunner.executor.handlers;

import com.caserunner.core.TestCase;
import com.caserunner.executor.CaseConfigException;
import com.caserunner.executor.DirectiveArguments;
import com.caserunner.model.Problem;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.caserunner.support.CaseFactory.callTo;
import static com.caserunner.support.CaseFactory.entry;
import static com.caserunner.support.CaseFactory.environment;
import static com.caserunner.support.CaseFactory.literal;
import static com.caserunner.support.CaseFactory.stage;
import static com.caserunner.support.CaseFactory.testCase;
import static com.caserunner.support.CaseFactory.variable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Argument adapters and handlers of the built-in directives.
 */
public class BuiltinDirectivesTest {

    private TestCase tc;

    @BeforeMethod
    public void setUp() {
        tc = testCase(stage(), stage(), stage());
        tc.getSymbols().set("region", "eu-west");
    }

    @SafeVarargs
    private static TestCase runTest(Map<String, Object>... entries) {
        TestCase testCase = testCase(stage(), stage(entries), stage());
        testCase.run();
        return testCase;
    }

    // ════════════════════════════════════════════════════════════════════════
    // call / call_may_fail adapter
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void forCall_resolvesArgsAndParams() {
        Map<String, Object> declared = new LinkedHashMap<>();
        declared.put("target", "deploy");
        declared.put("args", List.of(literal("fast"), variable("region")));
        declared.put("params", Map.of("zone", variable("region")));

        DirectiveArguments args = ArgumentAdapters.forCall(tc, declared);

        assertThat(args.getPositional()).containsExactly("deploy", "fast", "eu-west");
        assertThat(args.getKeyword()).containsEntry("zone", "eu-west");
    }

    @Test
    public void forCall_rejectsMalformedBlocks() {
        assertThatThrownBy(() -> ArgumentAdapters.forCall(tc, Map.of("args", List.of())))
            .isInstanceOf(CaseConfigException.class)
            .hasMessageContaining("\"- target: TARGET\"");
        assertThatThrownBy(() -> ArgumentAdapters.forCall(tc, Map.of("target", "x", "extra", 1)))
            .isInstanceOf(CaseConfigException.class)
            .hasMessageContaining("unknown argument to function call \"- extra\"");
        assertThatThrownBy(() -> ArgumentAdapters.forCall(tc, Map.of("target", "x", "args", "notalist")))
            .isInstanceOf(CaseConfigException.class);
        assertThatThrownBy(() -> ArgumentAdapters.forCall(tc, "just a string"))
            .isInstanceOf(CaseConfigException.class);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Message-style adapter
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void argsString_looksUpSymbolsAndQuotesTheRest() {
        DirectiveArguments args = ArgumentAdapters.argsString(tc, List.of("in {} as {}", "region", "admin"));
        assertThat(args.getPositional()).containsExactly("in {} as {}", "eu-west", "\"admin\"");

        assertThat(ArgumentAdapters.argsString(tc, "plain").getPositional()).containsExactly("plain");
        assertThat(ArgumentAdapters.argsString(tc, null).size()).isZero();
        assertThat(ArgumentAdapters.argsString(tc, List.of()).size()).isZero();
        assertThatThrownBy(() -> ArgumentAdapters.argsString(tc, Map.of("a", 1)))
            .isInstanceOf(CaseConfigException.class);
    }

    @Test
    public void log_writesFormattedLine() {
        TestCase run = runTest(entry("uuid", "id"), entry("log", List.of("case {} ({testcase_id})", "testcase_num")));
        assertThat(run.getOutput()).contains("case 1 (sample case)\n");
    }

    // ════════════════════════════════════════════════════════════════════════
    // uuid / env
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void uuid_declarativeAndFromCode() {
        assertThat(ArgumentAdapters.forUuid(tc, "token").isDeclarativeOnly()).isTrue();
        String first = (String) tc.getSymbols().get("token");
        assertThat(first).matches("[0-9a-f-]{36}");

        Object second = tc.getDirectives().call("uuid", List.of(), Map.of());
        assertThat(second).isNotEqualTo(first);

        assertThatThrownBy(() -> ArgumentAdapters.forUuid(tc, null)).isInstanceOf(CaseConfigException.class);
    }

    @Test
    public void env_needsBothKeys() {
        assertThatThrownBy(() -> ArgumentAdapters.forEnv(tc, Map.of("variable", "v")))
            .isInstanceOf(CaseConfigException.class)
            .hasMessage("need both \"name\" and \"variable\"");
    }

    @Test
    public void env_fromCode() {
        TestCase run = new TestCase(environment().variable("STAGE", "qa").build(), 2, "env",
            stage(), stage(entry("code", "where = env('STAGE')")), stage());
        run.run();
        assertThat(run.getSymbols().get("where")).isEqualTo("qa");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Processes from code
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void processDirectives_fromCode() {
        TestCase run = runTest(entry("code", String.join("\n",
            "out = call('echo', 'hi')",
            "res = call_may_fail('fail')",
            "sh = shell('echo {}-{}', 'a', 'b')")));

        assertThat(run.getProblemCount()).isZero();
        assertThat(run.getSymbols().get("out")).isEqualTo("hi\n");
        assertThat(run.getSymbols().get("res")).isEqualTo(List.of(3, "broken\n"));
        assertThat(run.getSymbols().get("sh")).isEqualTo(List.of(0, "a-b\n"));
    }

    @Test
    public void call_fromCode_abortsOnFailure() {
        TestCase run = runTest(entry("code", "call('fail', 'now')\nlog('unreachable')"));
        assertThat(run.getFailures()).extracting(Problem::getMessage)
            .containsExactly("call failed: \"[fail, now]\"");
        assertThat(run.getOutput()).doesNotContain("unreachable");
    }

    @Test
    public void shell_declarative_quotesUnknownTokens() {
        TestCase run = runTest(entry("shell", List.of("echo", "greeting")));
        assertThat(run.getLastOutput()).isEqualTo("greeting\n");
        assertThat(run.getOutput()).contains("# Calling: echo \"greeting\"");
    }

    // ════════════════════════════════════════════════════════════════════════
    // extract_match
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void extractMatch_singleVariable() {
        TestCase run = runTest(
            entry("call", callTo("echo", "version 1.2.3")),
            entry("extract_match", Map.of("pattern", "version (\\S+)", "variable", "version")));
        assertThat(run.getSymbols().get("version")).isEqualTo("1.2.3");
    }

    @Test
    public void extractMatch_noMatch_bindsNull() {
        TestCase run = runTest(
            entry("call", callTo("echo", "nothing here")),
            entry("extract_match", Map.of("pattern", "id=(\\d+)", "groups", List.of("a", "b"))));
        assertThat(run.getSymbols().contains("a")).isTrue();
        assertThat(run.getSymbols().get("a")).isNull();
        assertThat(run.getSymbols().get("b")).isNull();
    }

    @Test
    public void extractMatch_fromCodeWithKeywords() {
        TestCase run = runTest(
            entry("call", callTo("echo", "user=ann")),
            entry("code", "extract_match('user=(\\\\w+)', variable='user')"));
        assertThat(run.getSymbols().get("user")).isEqualTo("ann");
    }

    @Test
    public void extractMatch_rejectsBadArguments() {
        assertThat(runTest(entry("extract_match", Map.of("variable", "v")))
            .getErrors().get(0).getMessage()).contains("extract_match requires pattern to match");
        assertThat(runTest(entry("extract_match", Map.of("pattern", "x")))
            .getErrors().get(0).getMessage()).contains("extract_match requires variable or groups");
        assertThat(runTest(entry("extract_match", Map.of("pattern", "(x)", "variable", "v", "groups", List.of("g"))))
            .getErrors().get(0).getMessage()).contains("cannot accept both");
        assertThat(runTest(entry("extract_match", Map.of("pattern", "(x", "variable", "v")))
            .getErrors().get(0).getMessage()).contains("invalid pattern");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Output checks
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void forContains_readsOptions() {
        DirectiveArguments args = ArgumentAdapters.forContains(tc, List.of(
            Map.of("message", "where is {}?", "case_sensitive", true),
            literal("a"), variable("region")));

        assertThat(args.getPositional()).containsExactly("a", "eu-west");
        assertThat(args.getKeyword("message", null)).isEqualTo("where is {}?");
        assertThat(args.getKeyword("case_sensitive", null)).isEqualTo(true);

        DirectiveArguments plain = ArgumentAdapters.forContains(tc, List.of(literal("b")));
        assertThat(plain.getKeyword("message", null)).isEqualTo("");
        assertThat(plain.getKeyword("case_sensitive", null)).isEqualTo(false);
    }

    @Test
    public void containmentDirectives() {
        TestCase run = runTest(
            entry("call", callTo("echo", "Alpha Beta")),
            entry("assert_contains", List.of(literal("alpha"), literal("beta"))),
            entry("assert_contains_any", List.of(literal("zeta"), literal("beta"))),
            entry("assert_not_contains", List.of(literal("zeta"))),
            entry("assert_excludes", List.of(literal("gamma"), literal("delta"))),
            entry("assert_excludes_any", List.of(literal("alpha"), literal("omega"))),
            entry("assert_contains", List.of(Map.of("message", "lower {} missing", "case_sensitive", true),
                literal("alpha"))));

        assertThat(run.getFailures()).extracting(Problem::getMessage)
            .containsExactly("lower [alpha] missing");
    }

    @Test
    public void containment_withNullVariable_isAnError() {
        TestCase run = runTest(
            entry("call", callTo("echo", "null")),
            entry("extract_match", Map.of("pattern", "id=(\\d+)", "variable", "id")),
            entry("assert_contains", List.of(variable("id"))));

        assertThat(run.getFailures()).isEmpty();
        assertThat(run.getErrors()).extracting(Problem::getCategory)
            .containsExactly("UNHANDLED EXCEPTION in stage TEST");
        assertThat(run.getErrors().get(0).getMessage())
            .startsWith("CaseConfigException: cannot look for a null value");
    }

    @Test
    public void containmentFromCode_honoursKeywords() {
        TestCase run = runTest(
            entry("call", callTo("echo", "Alpha")),
            entry("code", "assert_contains('ALPHA')\nassert_excludes('ALPHA', case_sensitive=True, message='fine')"));
        assertThat(run.getProblemCount()).isZero();
    }

    @Test
    public void conditionHandlers_needAMessage() {
        TestCase run = runTest(entry("code", "expect(True)"));
        assertThat(run.getErrors().get(0).getMessage()).contains("expect needs a message");
    }
}
