package com.caserunner.executor;

import com.caserunner.core.TestCase;
import com.caserunner.script.ScriptFunction;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.caserunner.support.CaseFactory.entry;
import static com.caserunner.support.CaseFactory.stage;
import static com.caserunner.support.CaseFactory.testCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DirectiveTableTest {

    private TestCase owner;
    private DirectiveTable table;
    private List<DirectiveArguments> received;

    @BeforeMethod
    public void setUp() {
        owner = testCase(stage(), stage(), stage());
        table = new DirectiveTable(owner);
        received = new ArrayList<>();
    }

    private DirectiveHandler recording(Object result) {
        return (tc, args) -> {
            assertThat(tc).isSameAs(owner);
            received.add(args);
            return result;
        };
    }

    @Test
    public void invoke_adaptsThenCallsHandler() {
        table.register("greet", recording("done"), (tc, declared) -> DirectiveArguments.of("hello", declared));

        assertThat(table.invoke("greet", "world")).isEqualTo("done");
        assertThat(received).hasSize(1);
        assertThat(received.get(0).getPositional()).containsExactly("hello", "world");
    }

    @Test
    public void declarativeOnlyAdapter_skipsHandler() {
        table.register("quiet", recording("unused"), (tc, declared) -> DirectiveArguments.declarativeOnly());

        assertThat(table.invoke("quiet", null)).isNull();
        assertThat(received).isEmpty();
    }

    @Test
    public void codeOnlyDirective_cannotBeInvokedDeclaratively() {
        table.register("secret", recording(1), null);

        assertThatThrownBy(() -> table.invoke("secret", null))
            .isInstanceOf(CaseConfigException.class)
            .hasMessage("directive only available inside a code directive: secret");
        assertThat(table.call("secret", List.of(1), Map.of())).isEqualTo(1);
    }

    @Test
    public void unknownDirective() {
        assertThatThrownBy(() -> table.runEntry(entry("nope", null)))
            .isInstanceOfSatisfying(UnknownDirectiveException.class,
                e -> assertThat(e.getDirective()).isEqualTo("nope"));
    }

    @Test
    public void runEntry_needsExactlyOneKey() {
        table.register("a", recording(null), (tc, d) -> DirectiveArguments.empty());
        Map<String, Object> two = entry("a", null);
        two.put("b", null);

        assertThatThrownBy(() -> table.runEntry(Map.of())).isInstanceOf(CaseConfigException.class);
        assertThatThrownBy(() -> table.runEntry(two)).isInstanceOf(CaseConfigException.class);
        assertThat(received).isEmpty();
    }

    @Test
    public void duplicateNames_areRejected() {
        table.registerValue("x", 1);
        assertThatThrownBy(() -> table.register("x", recording(null), null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void symbolValue_bindsHandlersToTheCase() {
        table.registerValue("answer", 42);
        table.register("echo", (tc, args) -> args.getPositional(), null);

        assertThat(table.symbolValue(table.resolve("answer"))).isEqualTo(42);
        Object bound = table.symbolValue(table.resolve("echo"));
        assertThat(bound).isInstanceOf(ScriptFunction.class);
        assertThat(((ScriptFunction) bound).call(List.of("a"), Map.of())).isEqualTo(List.of("a"));
    }

    @Test
    public void valuesCannotBeCalled() {
        table.registerValue("answer", 42);
        assertThatThrownBy(() -> table.call("answer", List.of(), Map.of()))
            .isInstanceOf(CaseConfigException.class);
    }

    @Test
    public void caseTable_holdsEveryBuiltin() {
        DirectiveTable builtins = owner.getDirectives();
        assertThat(builtins.contains("call")).isTrue();
        assertThat(builtins.contains("assert_not_contains")).isTrue();
        assertThat(builtins.resolve("expect").isDeclarative()).isFalse();
        assertThat(builtins.resolve("testcase_num").isValue()).isTrue();
        assertThat(owner.getSymbols().names()).containsAll(
            builtins.entries().stream().map(DirectiveEntry::getName).toList());
    }
}
