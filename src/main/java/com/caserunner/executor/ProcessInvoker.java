package com.caserunner.executor;

import com.caserunner.core.CaseRunnerConfig;
import com.caserunner.core.Environment;
import com.caserunner.core.MessageFormatter;
import com.caserunner.core.SymbolTable;
import com.caserunner.core.Transcript;
import com.caserunner.model.CallTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs external commands for one case and remembers the last result.
 *
 * Every command goes through the configured shell with stderr merged into
 * stdout and blocks until the process exits. The last exit code and output are
 * reset before each attempt, so a call that fails to resolve or launch never
 * leaves the previous call's success behind. The {@value #LAST_CALL_OUTPUT}
 * symbol follows the same state.
 *
 * A non-zero exit is not an error here; see {@link AssertionEngine} for checks.
 */
public class ProcessInvoker {

    private static final Logger log = LoggerFactory.getLogger(ProcessInvoker.class);

    public static final String LAST_CALL_OUTPUT = "_last_call_output";

    static final String CALLING_MARKER = "# Calling: ";
    static final String CALL_FAILED_MARKER = "# ... call did not succeed  ";

    private final Environment      environment;
    private final CaseRunnerConfig config;
    private final Transcript       transcript;
    private final SymbolTable      symbols;
    private final MessageFormatter formatter;

    private int    lastExitCode = 0;
    private String lastOutput   = "";

    public ProcessInvoker(Environment environment, CaseRunnerConfig config, Transcript transcript,
                          SymbolTable symbols, MessageFormatter formatter) {
        this.environment = environment;
        this.config      = config;
        this.transcript  = transcript;
        this.symbols     = symbols;
        this.formatter   = formatter;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Resolves {@code target} through the environment and runs it, whatever
     * its exit code.
     *
     * @throws CallException if the target cannot be resolved or launched
     */
    public CallResult callAllowError(String target, List<Object> args, Map<String, Object> params) {
        resetLastCall();
        CallTarget resolved;
        try {
            resolved = environment.resolveCall(target, args, params);
        } catch (RuntimeException e) {
            log.debug("ProcessInvoker: could not resolve '{}': {}", target, e.getMessage());
            throw new CallException("could not resolve call: " + e.getMessage(), e);
        }
        if (resolved == null || resolved.getCommandLine() == null) {
            throw new CallException("could not resolve call: no command for target '" + target + "'");
        }
        return invokeExternal(resolved.getCommandLine(), resolved.getWorkingDirectory());
    }

    /**
     * Runs a literal command line built from {@code template}: each argument
     * fills a {@code {}} slot, and arguments beyond the template's slots are
     * appended after a space.
     */
    public CallResult shell(String template, List<Object> args) {
        int missing = args.size() - formatter.countSlots(template);
        String full = missing > 0 ? template + " {}".repeat(missing) : template;
        return invokeExternal(formatter.format(full, args.toArray()), null);
    }

    /**
     * Runs {@code commandLine} in {@code workingDirectory} (null = current).
     *
     * @throws CallException            if the process cannot be started or read
     * @throws CaseInterruptedException if the thread is interrupted before or during the call
     */
    public CallResult invokeExternal(String commandLine, Path workingDirectory) {
        resetLastCall();
        transcript.append("\n" + CALLING_MARKER + commandLine + "\n");

        if (Thread.currentThread().isInterrupted()) {
            throw new CaseInterruptedException("interrupted before running: " + commandLine);
        }

        List<String> command = new ArrayList<>(config.getShell());
        command.add(commandLine);
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        log.debug("ProcessInvoker: running {} (dir={})", commandLine,
            workingDirectory != null ? workingDirectory : ".");

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new CallException("could not launch '" + commandLine + "': " + e.getMessage(), e);
        }

        OutputDrain drain = new OutputDrain(process.getInputStream(), commandLine);
        drain.start();

        int exitCode;
        try {
            exitCode = process.waitFor();
            drain.join();
        } catch (InterruptedException e) {
            terminate(process);
            Thread.currentThread().interrupt();
            log.debug("ProcessInvoker: interrupted, destroyed '{}'", commandLine);
            throw new CaseInterruptedException("interrupted while running: " + commandLine, e);
        }
        if (drain.failure != null) {
            throw new CallException("could not read output of '" + commandLine + "': " +
                drain.failure.getMessage(), drain.failure);
        }
        String output = new String(drain.bytes.toByteArray(), config.getOutputCharset());

        if (exitCode != 0) {
            transcript.append(CALL_FAILED_MARKER);
            log.debug("ProcessInvoker: '{}' exited with {}", commandLine, exitCode);
        }

        lastExitCode = exitCode;
        lastOutput   = output;
        symbols.set(LAST_CALL_OUTPUT, output);
        transcript.append(output);
        return new CallResult(exitCode, output);
    }

    private static void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Reads a process's merged output off the case thread, so the case thread
     * can wait in {@link Process#waitFor()} and still react to an interrupt.
     */
    private static final class OutputDrain extends Thread {
        private final InputStream in;
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private volatile IOException failure;

        OutputDrain(InputStream in, String commandLine) {
            super("caserunner-output: " + commandLine);
            this.in = in;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (InputStream stream = in) {
                stream.transferTo(bytes);
            } catch (IOException e) {
                failure = e;
            }
        }
    }

    // ── Last call state ───────────────────────────────────────────────────────

    public int getLastExitCode() { return lastExitCode; }

    public String getLastOutput() { return lastOutput; }

    private void resetLastCall() {
        lastExitCode = 0;
        lastOutput   = "";
        symbols.set(LAST_CALL_OUTPUT, "");
    }
}
