package com.caserunner.executor;

import com.caserunner.core.MessageFormatter;
import com.caserunner.core.Transcript;
import com.caserunner.model.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Expectations, assertions and output checks for one case.
 *
 * Both severities record a failure and annotate the transcript. They differ in
 * what happens next:
 *
 *   EXPECT  -- the stage continues with its next directive
 *   ASSERT  -- a {@link StageAbortException} unwinds the rest of the stage
 */
public class AssertionEngine {

    private static final Logger log = LoggerFactory.getLogger(AssertionEngine.class);

    public static final String FAILED_EXPECTATION = "FAILED EXPECTATION";
    public static final String FAILED_ASSERTION   = "FAILED ASSERTION";

    public enum Severity {
        EXPECT("expected"),
        ASSERT("required");

        private final String label;

        Severity(String label) { this.label = label; }

        public String getLabel() { return label; }
    }

    public enum Aggregator {
        ALL("all of"),
        ANY("any of");

        private final String label;

        Aggregator(String label) { this.label = label; }

        public String getLabel() { return label; }

        boolean combine(List<Boolean> results) {
            return this == ALL
                ? results.stream().allMatch(Boolean::booleanValue)
                : results.stream().anyMatch(Boolean::booleanValue);
        }
    }

    private final ProcessInvoker   invoker;
    private final Transcript       transcript;
    private final MessageFormatter formatter;
    private final List<Problem>    failures = new ArrayList<>();

    public AssertionEngine(ProcessInvoker invoker, Transcript transcript, MessageFormatter formatter) {
        this.invoker    = invoker;
        this.transcript = transcript;
        this.formatter  = formatter;
    }

    // ── Severities ────────────────────────────────────────────────────────────

    /** Records a failure if {@code condition} is false; the stage continues. */
    public void expect(boolean condition, String message, Object... args) {
        if (!condition) {
            recordFailure(FAILED_EXPECTATION, message, args);
            transcript.printOut("# " + FAILED_EXPECTATION + ": " + message, args);
        }
    }

    /** Records a failure and aborts the stage if {@code condition} is false. */
    public void assertThat(boolean condition, String message, Object... args) {
        if (!condition) {
            recordFailure(FAILED_ASSERTION, message, args);
            transcript.printOut("# " + FAILED_ASSERTION + ": " + message, args);
            throw new StageAbortException(formatter.format(message, args));
        }
    }

    public void check(Severity severity, boolean condition, String message, Object... args) {
        if (severity == Severity.ASSERT) {
            assertThat(condition, message, args);
        } else {
            expect(condition, message, args);
        }
    }

    public void fail() {
        expect(false, "failure");
    }

    public void abort() {
        assertThat(false, "abort called");
    }

    // ── Last call checks ──────────────────────────────────────────────────────

    public void assertSuccess(String message, Object... args) {
        boolean custom = message != null && !message.isEmpty();
        assertThat(invoker.getLastExitCode() == 0,
            custom ? message : "expected last call to succeed", custom ? args : new Object[0]);
    }

    public void assertFailure(String message, Object... args) {
        boolean custom = message != null && !message.isEmpty();
        assertThat(invoker.getLastExitCode() != 0,
            custom ? message : "expected last call to fail", custom ? args : new Object[0]);
    }

    /** Whether the last call's output contains {@code substr}. */
    public boolean lastOutputContains(String substr, boolean caseSensitive) {
        String output = invoker.getLastOutput();
        if (caseSensitive) {
            return output.contains(substr);
        }
        return output.toLowerCase(Locale.ROOT).contains(substr.toLowerCase(Locale.ROOT));
    }

    public boolean lastOutputContains(String substr) {
        return lastOutputContains(substr, false);
    }

    /**
     * Checks presence ({@code contains = true}) or absence of each value in the
     * last output and aggregates the results.
     *
     *   ALL + contains  -- every value present
     *   ANY + contains  -- at least one value present
     *   ALL + !contains -- every value absent
     *   ANY + !contains -- at least one value absent
     */
    public void checkContains(Severity severity, Aggregator aggregator, boolean contains,
                              boolean caseSensitive, String message, List<?> values) {
        Predicate<String> present = substr -> lastOutputContains(substr, caseSensitive);
        Predicate<String> condition = contains ? present : present.negate();
        String effective = message;
        if ((effective == null || effective.isEmpty()) && !contains) {
            effective = severity.getLabel() + " absence of " + aggregator.getLabel() +
                " the following values in the preceding output, but found them: {}";
        }
        checkSeveral(severity, aggregator, condition, effective, values);
    }

    /**
     * Applies {@code condition} to every value, combines the results with
     * {@code aggregator} and reports through {@code severity}. An empty
     * {@code message} gets a default naming the severity, the aggregator and
     * the values.
     *
     * @throws CaseConfigException if one of the values is null
     */
    public void checkSeveral(Severity severity, Aggregator aggregator, Predicate<String> condition,
                             String message, List<?> values) {
        List<Boolean> results = new ArrayList<>();
        for (Object value : values) {
            if (value == null) {
                String problem = "cannot look for a null value in the preceding output: " + values;
                log.error("AssertionEngine: {}", problem);
                throw new CaseConfigException(problem);
            }
            results.add(condition.test(String.valueOf(value)));
        }
        boolean passed = aggregator.combine(results);

        if (message == null || message.isEmpty()) {
            check(severity, passed, severity.getLabel() + ", but did not find, " + aggregator.getLabel() +
                " the following values in the preceding output: {}", values);
        } else if (formatter.countSlots(message) > 0) {
            check(severity, passed, message, values);
        } else {
            check(severity, passed, message);
        }
    }

    // ── Failures ──────────────────────────────────────────────────────────────

    public void recordFailure(String category, String message, Object... args) {
        Problem problem = new Problem(category, message, args, formatter.format(message, args));
        failures.add(problem);
        log.debug("AssertionEngine: {}", problem);
    }

    public List<Problem> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
