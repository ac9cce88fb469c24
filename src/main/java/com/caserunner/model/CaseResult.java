package com.caserunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a finished case, for the orchestrator to aggregate or
 * serialise (see {@link com.caserunner.util.CaseResults}).
 *
 * Immutable; use the builder.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CaseResult {

    private final int           index;
    private final String        label;
    private final CaseStatus    status;
    private final List<Problem> failures;
    private final List<Problem> errors;
    private final int           lastExitCode;
    private final String        transcript;
    private final Instant       startTime;
    private final Instant       endTime;

    private CaseResult(Builder b) {
        this.index        = b.index;
        this.label        = b.label;
        this.status       = b.status;
        this.failures     = b.failures != null ? List.copyOf(b.failures) : List.of();
        this.errors       = b.errors != null ? List.copyOf(b.errors) : List.of();
        this.lastExitCode = b.lastExitCode;
        this.transcript   = b.transcript;
        this.startTime    = b.startTime;
        this.endTime      = b.endTime;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int           getIndex()        { return index; }
    public String        getLabel()        { return label; }
    public CaseStatus    getStatus()       { return status; }
    public List<Problem> getFailures()     { return failures; }
    public List<Problem> getErrors()       { return errors; }
    public int           getLastExitCode() { return lastExitCode; }
    public String        getTranscript()   { return transcript; }
    public Instant       getStartTime()    { return startTime; }
    public Instant       getEndTime()      { return endTime; }

    /** failures + errors; the value {@code TestCase.run()} returned. */
    public int getProblemCount() { return failures.size() + errors.size(); }

    /** Wall-clock duration of the run, or {@code null} if it never finished. */
    public Long getDurationMillis() {
        if (startTime == null || endTime == null) return null;
        return Duration.between(startTime, endTime).toMillis();
    }

    @Override
    public String toString() {
        return String.format("CaseResult{index=%d, label='%s', status=%s, failures=%d, errors=%d}",
            index, label, status, failures.size(), errors.size());
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private int           index;
        private String        label;
        private CaseStatus    status;
        private List<Problem> failures;
        private List<Problem> errors;
        private int           lastExitCode;
        private String        transcript;
        private Instant       startTime;
        private Instant       endTime;

        public Builder index(int i)                  { this.index = i; return this; }
        public Builder label(String l)               { this.label = l; return this; }
        public Builder status(CaseStatus s)          { this.status = s; return this; }
        public Builder failures(List<Problem> f)     { this.failures = f; return this; }
        public Builder errors(List<Problem> e)       { this.errors = e; return this; }
        public Builder lastExitCode(int c)           { this.lastExitCode = c; return this; }
        public Builder transcript(String t)          { this.transcript = t; return this; }
        public Builder startTime(Instant t)          { this.startTime = t; return this; }
        public Builder endTime(Instant t)            { this.endTime = t; return this; }
        public CaseResult build()                    { return new CaseResult(this); }
    }
}
