package com.caserunner.executor;

import com.caserunner.core.CaseRunnerConfig;
import com.caserunner.core.MessageFormatter;
import com.caserunner.core.StaticEnvironment;
import com.caserunner.core.SymbolTable;
import com.caserunner.core.Transcript;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs real commands through /bin/sh.
 */
public class ProcessInvokerTest {

    private SymbolTable symbols;
    private Transcript transcript;
    private ProcessInvoker invoker;
    private Path workDir;

    @BeforeMethod
    public void setUp() throws Exception {
        workDir = Files.createTempDirectory("caserunner-invoker");
        StaticEnvironment environment = StaticEnvironment.builder()
            .target("echo", "echo")
            .target("where", "pwd", workDir)
            .target("exit", "exit")
            .build();
        symbols = new SymbolTable();
        MessageFormatter formatter = new MessageFormatter(environment::resolveSymbol, symbols);
        transcript = new Transcript(formatter);
        invoker = new ProcessInvoker(environment, CaseRunnerConfig.defaults(), transcript, symbols, formatter);
    }

    @Test
    public void successfulCall_capturesOutput() {
        CallResult result = invoker.callAllowError("echo", List.of("one", "two"), Map.of());

        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput()).isEqualTo("one two\n");
        assertThat(result.asList()).containsExactly(0, "one two\n");
        assertThat(invoker.getLastOutput()).isEqualTo("one two\n");
        assertThat(symbols.get(ProcessInvoker.LAST_CALL_OUTPUT)).isEqualTo("one two\n");
        assertThat(transcript.getText()).isEqualTo("\n# Calling: echo one two\none two\n");
    }

    @Test
    public void failingCall_isNotAnError() {
        CallResult result = invoker.callAllowError("exit", List.of(4), Map.of());

        assertThat(result.getExitCode()).isEqualTo(4);
        assertThat(result.isSuccess()).isFalse();
        assertThat(invoker.getLastExitCode()).isEqualTo(4);
        assertThat(transcript.getText()).endsWith(ProcessInvoker.CALL_FAILED_MARKER);
    }

    @Test
    public void stderr_isMergedIntoOutput() {
        CallResult result = invoker.shell("echo visible; echo hidden 1>&2", List.of());
        assertThat(result.getOutput()).contains("visible").contains("hidden");
    }

    @Test
    public void workingDirectory_comesFromTheTarget() throws Exception {
        CallResult result = invoker.callAllowError("where", List.of(), Map.of());
        assertThat(Path.of(result.getOutput().trim()).toRealPath()).isEqualTo(workDir.toRealPath());
    }

    @Test
    public void shell_appendsUncoveredArguments() {
        invoker.shell("echo {} and", List.of("a", "b", "c"));
        assertThat(transcript.getText()).contains("# Calling: echo a and b c\n");
        assertThat(invoker.getLastOutput()).isEqualTo("a and b c\n");
    }

    @Test
    public void unresolvableTarget_isCallException_andResetsLastCall() {
        invoker.callAllowError("exit", List.of(2), Map.of());

        assertThatThrownBy(() -> invoker.callAllowError("missing", List.of(), Map.of()))
            .isInstanceOf(CallException.class)
            .hasMessageStartingWith("could not resolve call: ");
        assertThat(invoker.getLastExitCode()).isZero();
        assertThat(invoker.getLastOutput()).isEmpty();
        assertThat(symbols.get(ProcessInvoker.LAST_CALL_OUTPUT)).isEqualTo("");
    }

    @Test
    public void interruptedThread_doesNotLaunch() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> invoker.invokeExternal("echo never", null))
                .isInstanceOf(CaseInterruptedException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(invoker.getLastOutput()).isEmpty();
    }

    @Test
    public void interruptWhileRunning_destroysTheProcessPromptly() throws Exception {
        Thread caseThread = Thread.currentThread();
        Thread interrupter = new Thread(() -> {
            try {
                Thread.sleep(200);
                caseThread.interrupt();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        long started = System.nanoTime();
        interrupter.start();
        try {
            assertThatThrownBy(() -> invoker.shell("sleep 5", List.of()))
                .isInstanceOf(CaseInterruptedException.class)
                .hasMessage("interrupted while running: sleep 5");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
            interrupter.join();
        }
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        assertThat(elapsedMillis).isLessThan(3000);
        assertThat(invoker.getLastOutput()).isEmpty();
    }

    @Test
    public void missingShell_isCallException() {
        SymbolTable table = new SymbolTable();
        MessageFormatter formatter = new MessageFormatter(n -> null, table);
        ProcessInvoker broken = new ProcessInvoker(StaticEnvironment.builder().build(),
            CaseRunnerConfig.builder().shell(List.of("/definitely/not/a/shell")).build(),
            new Transcript(formatter), table, formatter);

        assertThatThrownBy(() -> broken.invokeExternal("echo x", null))
            .isInstanceOf(CallException.class)
            .hasMessageContaining("could not launch");
    }
}
