package com.caserunner.core;

import com.caserunner.executor.AssertionEngine;
import com.caserunner.executor.CallException;
import com.caserunner.executor.CaseConfigException;
import com.caserunner.executor.CaseInterruptedException;
import com.caserunner.executor.DirectiveEntry;
import com.caserunner.executor.DirectiveHandlerRegistry;
import com.caserunner.executor.DirectiveTable;
import com.caserunner.executor.ProcessInvoker;
import com.caserunner.executor.StageAbortException;
import com.caserunner.executor.handlers.BuiltinDirectives;
import com.caserunner.model.CaseDefinition;
import com.caserunner.model.CaseResult;
import com.caserunner.model.CaseStatus;
import com.caserunner.model.Problem;
import com.caserunner.model.Stage;
import com.caserunner.script.ScriptEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One declarative test case and the engine that runs it.
 *
 * A case is built from three ordered stage lists, each a sequence of
 * single-directive maps, and is run exactly once:
 *
 * <pre>
 *   SETUP ──► TEST ──► TEARDOWN ──► DONE
 *     │         │          ▲
 *     └─────────┴──────────┘  a failed assertion or an error skips to TEARDOWN
 * </pre>
 *
 * Stage outcomes:
 * <ul>
 *   <li>failed assertion: already recorded as a failure; the stage stops.</li>
 *   <li>{@link CallException}: error {@code CALL ERROR in stage S}.</li>
 *   <li>{@link CaseInterruptedException}: error {@code INTERRUPTED in stage S},
 *       rethrown; no further stage runs, not even TEARDOWN.</li>
 *   <li>anything else: error {@code UNHANDLED EXCEPTION in stage S} with a
 *       stack trace.</li>
 * </ul>
 * A failed assertion during TEARDOWN is an error
 * ({@code unexpected TEST FAILURE in stage TEARDOWN}), not a failure.
 *
 * Not thread-safe.
 */
public class TestCase {

    private static final Logger log = LoggerFactory.getLogger(TestCase.class);

    static final String CALL_ERROR          = "CALL ERROR in stage %s";
    static final String INTERRUPTED         = "INTERRUPTED in stage %s";
    static final String UNHANDLED_EXCEPTION = "UNHANDLED EXCEPTION in stage %s";
    static final String TEARDOWN_FAILURE    = "unexpected TEST FAILURE in stage TEARDOWN";

    private static final int MAX_STACK_FRAMES = 15;

    private final Environment      environment;
    private final CaseRunnerConfig config;
    private final int              index;
    private final String           label;
    private final List<Map<String, Object>> setup;
    private final List<Map<String, Object>> test;
    private final List<Map<String, Object>> teardown;

    private final SymbolTable      symbols;
    private final MessageFormatter formatter;
    private final Transcript       transcript;
    private final ProcessInvoker   invoker;
    private final AssertionEngine  assertions;
    private final ScriptEngine     scriptEngine;
    private final DirectiveTable   directives;

    private final List<Problem> errors = new ArrayList<>();

    private Stage   stage;
    private boolean started = false;
    private Instant startTime;
    private Instant endTime;

    public TestCase(Environment environment, int index, String label,
                    List<Map<String, Object>> setup,
                    List<Map<String, Object>> test,
                    List<Map<String, Object>> teardown) {
        this(environment, CaseRunnerConfig.defaults(), DirectiveHandlerRegistry.empty(),
            new CaseDefinition(index, label, setup, test, teardown));
    }

    public TestCase(Environment environment, CaseDefinition definition) {
        this(environment, CaseRunnerConfig.defaults(), DirectiveHandlerRegistry.empty(), definition);
    }

    public TestCase(Environment environment, CaseRunnerConfig config,
                    DirectiveHandlerRegistry extensions, CaseDefinition definition) {
        this.environment = environment;
        this.config      = config != null ? config : CaseRunnerConfig.defaults();
        this.index       = definition.getIndex();
        this.label       = definition.getLabel();
        this.setup       = definition.getSetup();
        this.test        = definition.getTest();
        this.teardown    = definition.getTeardown();

        this.symbols      = new SymbolTable();
        this.formatter    = new MessageFormatter(environment::resolveSymbol, symbols);
        this.transcript   = new Transcript(formatter);
        this.invoker      = new ProcessInvoker(environment, this.config, transcript, symbols, formatter);
        this.assertions   = new AssertionEngine(invoker, transcript, formatter);
        this.scriptEngine = new ScriptEngine();
        this.directives   = new DirectiveTable(this);

        BuiltinDirectives.registerAll(directives, index, label);
        (extensions != null ? extensions : DirectiveHandlerRegistry.empty()).registerInto(directives);
        for (DirectiveEntry entry : directives.entries()) {
            symbols.set(entry.getName(), directives.symbolValue(entry));
        }
        log.debug("TestCase: case {} \"{}\" ready with {} directive(s)", index, label, directives.size());
    }

    // ── Run ───────────────────────────────────────────────────────────────────

    /**
     * Runs SETUP, TEST and TEARDOWN.
     *
     * @return number of failures plus number of errors
     * @throws CaseInterruptedException if the thread was interrupted; the
     *         error is recorded before this is thrown
     * @throws IllegalStateException    if the case has already been run
     */
    public int run() {
        if (started) {
            throw new IllegalStateException("Test case " + index + " has already been run");
        }
        started = true;
        startTime = Instant.now();
        try {
            if (runStage(Stage.SETUP, setup)) {
                runStage(Stage.TEST, test);
            }
            runStage(Stage.TEARDOWN, teardown);
        } finally {
            stage = Stage.DONE;
            endTime = Instant.now();
        }
        logSummary();
        return getProblemCount();
    }

    /** @return {@code true} if every entry of the stage ran to completion */
    private boolean runStage(Stage current, List<Map<String, Object>> entries) {
        stage = current;
        transcript.printOut("\n### Test case " + current.name());
        log.debug("TestCase: case {} entering {}", index, current);
        try {
            for (Map<String, Object> entry : entries) {
                directives.runEntry(entry);
            }
            return true;
        } catch (StageAbortException e) {
            if (current == Stage.TEARDOWN) {
                recordError(TEARDOWN_FAILURE, "test failure in stage TEARDOWN");
                transcript.printOut("{}", TEARDOWN_FAILURE);
            } else {
                log.debug("TestCase: case {} {} stopped: {}", index, current, e.getMessage());
            }
        } catch (CallException e) {
            String category = String.format(CALL_ERROR, current.name());
            recordError(category, e.getMessage());
            transcript.printOut(category + ": {}", e.getMessage());
        } catch (CaseInterruptedException e) {
            String category = String.format(INTERRUPTED, current.name());
            recordError(category, "interrupt detected");
            transcript.printOut("{}", category);
            log.error("TestCase: case {} \"{}\" {}", index, label, category);
            throw e;
        } catch (RuntimeException e) {
            String category = String.format(UNHANDLED_EXCEPTION, current.name());
            String shortDescription = describe(e);
            recordError(category, shortDescription + "\n" + stackTraceToString(e));
            transcript.printOut("# EXCEPTION!! {}", shortDescription);
            log.debug("TestCase: case {} {} threw", index, current, e);
        }
        return false;
    }

    // ── Problems ──────────────────────────────────────────────────────────────

    /** Records an error. The message is stored as given, without interpolation. */
    public void recordError(String category, String message) {
        Problem problem = new Problem(category, "{}", new Object[] { message }, message);
        errors.add(problem);
        log.debug("TestCase: {}", problem);
    }

    public List<Problem> getFailures() {
        return assertions.getFailures();
    }

    public List<Problem> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int getProblemCount() {
        return getFailures().size() + errors.size();
    }

    public CaseStatus getStatus() {
        if (!getFailures().isEmpty()) return CaseStatus.FAILED;
        if (!errors.isEmpty())        return CaseStatus.ERRORED;
        return CaseStatus.PASSED;
    }

    // ── Reporting ─────────────────────────────────────────────────────────────

    private void logSummary() {
        CaseStatus status = getStatus();
        log.info("---- Test case {}: \"{}\" {} ----", index, label, status);
        for (Problem failure : getFailures()) {
            log.info("    {}: {}", failure.getCategory(), failure.getMessage());
        }
        for (Problem error : errors) {
            log.info("    {}: (check state: clean-up did not finish) {}", error.getCategory(), error.getMessage());
        }
        if (status != CaseStatus.PASSED || config.isAlwaysLogTranscript()) {
            log.info("    Output:\n{}\n", getOutput(config.getTranscriptIndent(), "| "));
        }
    }

    /** The transcript with every line indented by {@code indent} spaces and prefixed with {@code header}. */
    public String getOutput(int indent, String header) {
        return transcript.reindented(indent, header);
    }

    public String getOutput() {
        return transcript.getText();
    }

    /** Immutable snapshot of the case as it stands now. */
    public CaseResult getResult() {
        return CaseResult.builder()
            .index(index)
            .label(label)
            .status(getStatus())
            .failures(new ArrayList<>(getFailures()))
            .errors(new ArrayList<>(errors))
            .lastExitCode(invoker.getLastExitCode())
            .transcript(transcript.getText())
            .startTime(startTime)
            .endTime(endTime)
            .build();
    }

    // ── Collaborators for handlers ────────────────────────────────────────────

    /** Name of the call field holding the target, from the environment's settings. */
    public String getCallTargetKey() {
        Map<String, String> settings = environment.getSettings();
        if (settings == null) {
            return Environment.DEFAULT_CALL_TARGET_KEY;
        }
        return settings.getOrDefault(Environment.SETTING_CALL_TARGET, Environment.DEFAULT_CALL_TARGET_KEY);
    }

    /**
     * @throws CaseConfigException if the variable is not set
     */
    public String getEnvironmentVariable(String name) {
        String value = environment.getenv(name);
        if (value == null) {
            String message = "environment variable not set: " + name;
            log.error("TestCase: {}", message);
            throw new CaseConfigException(message);
        }
        return value;
    }

    public Environment      getEnvironment()  { return environment; }
    public CaseRunnerConfig getConfig()       { return config; }
    public int              getIndex()        { return index; }
    public String           getLabel()        { return label; }
    public Stage            getStage()        { return stage; }
    public Instant          getStartTime()    { return startTime; }
    public Instant          getEndTime()      { return endTime; }
    public SymbolTable      getSymbols()      { return symbols; }
    public MessageFormatter getFormatter()    { return formatter; }
    public Transcript       getTranscript()   { return transcript; }
    public ProcessInvoker   getInvoker()      { return invoker; }
    public AssertionEngine  getAssertions()   { return assertions; }
    public ScriptEngine     getScriptEngine() { return scriptEngine; }
    public DirectiveTable   getDirectives()   { return directives; }

    public int    getLastExitCode() { return invoker.getLastExitCode(); }
    public String getLastOutput()   { return invoker.getLastOutput(); }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }

    private static String stackTraceToString(Throwable e) {
        StringBuilder sb = new StringBuilder();
        StackTraceElement[] frames = e.getStackTrace();
        int limit = Math.min(MAX_STACK_FRAMES, frames.length);
        for (int i = 0; i < limit; i++) {
            sb.append("  at ").append(frames[i]).append("\n");
        }
        if (frames.length > limit) {
            sb.append("  ... ").append(frames.length - limit).append(" more frames\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("TestCase{%d \"%s\" stage=%s}", index, label, stage);
    }
}
