package com.caserunner.core;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class MessageFormatterTest {

    private SymbolTable symbols;
    private MessageFormatter formatter;

    @BeforeMethod
    public void setUp() {
        symbols = new SymbolTable();
        Map<String, String> environment = Map.of("lang", "java", "shared", "from-environment");
        formatter = new MessageFormatter(environment::get, symbols);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Positional slots
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void slots_areFilledLeftToRight() {
        assertThat(formatter.format("{} and {}", "a", 2)).isEqualTo("a and 2");
    }

    @Test
    public void extraArguments_areAppended() {
        assertThat(formatter.format("values", 1, 2)).isEqualTo("values: 1 2");
        assertThat(formatter.format("one {}", "x", "y", List.of("z"))).isEqualTo("one x: y [z]");
    }

    @Test
    public void missingArguments_leaveSlotsEmpty() {
        assertThat(formatter.format("{}-{}", "a")).isEqualTo("a-");
    }

    @Test
    public void noArguments_leavesPlainTextAlone() {
        assertThat(formatter.format("nothing to see")).isEqualTo("nothing to see");
        assertThat(formatter.countSlots("{} {x} {}")).isEqualTo(2);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Named symbols
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void namedSymbols_preferTheEnvironment() {
        symbols.set("shared", "from-case");
        symbols.set("count", 3);
        assertThat(formatter.format("{lang} {shared} {count}")).isEqualTo("java from-environment 3");
    }

    @Test
    public void unknownNames_stayVerbatim() {
        assertThat(formatter.format("hello {stranger}")).isEqualTo("hello {stranger}");
    }

    @Test
    public void interpolatedText_isNotScannedForSlots() {
        symbols.set("braces", "{}");
        assertThat(formatter.format("x {braces} {}", "A")).isEqualTo("x {} A");
        assertThat(formatter.countSlots("{braces}")).isZero();
    }

    @Test
    public void interpolateSymbols_usesOnlyTheResolver() {
        String out = MessageFormatter.interpolateSymbols("{a}/{b}", name -> name.equals("a") ? "1" : null);
        assertThat(out).isEqualTo("1/{b}");
    }

    @Test
    public void replacementText_isTakenLiterally() {
        symbols.set("money", "$1 \\ back");
        assertThat(formatter.format("cost {money}")).isEqualTo("cost $1 \\ back");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Transcript
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void transcript_formatsLinesAndAppendsRawText() {
        Transcript transcript = new Transcript(formatter);
        transcript.printOut("running {lang} {}", "now");
        transcript.append("raw {lang}");
        assertThat(transcript.getText()).isEqualTo("running java now\nraw {lang}");
        assertThat(transcript.reindented(2, "> ")).isEqualTo("  > running java now\n  > raw {lang}");
    }
}
