package com.caserunner.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration shared by all cases of a run.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   CASERUNNER_SHELL                 - Shell prefix that receives the command line as its last argument,
 *                                      whitespace separated (default: "/bin/sh -c")
 *   CASERUNNER_CHARSET               - Charset used to decode process output (default: UTF-8)
 *   CASERUNNER_ALWAYS_LOG_TRANSCRIPT - Log the transcript for passing cases too (default: false)
 *   CASERUNNER_TRANSCRIPT_INDENT     - Spaces before each logged transcript line (default: 4)
 *   CASERUNNER_DIRECTIVE_PACKAGE     - Package scanned for @HandlesDirective extensions (optional)
 */
public class CaseRunnerConfig {

    private static final Logger log = LoggerFactory.getLogger(CaseRunnerConfig.class);

    public static final List<String> DEFAULT_SHELL = List.of("/bin/sh", "-c");
    public static final int DEFAULT_TRANSCRIPT_INDENT = 4;

    private final List<String> shell;
    private final Charset      outputCharset;
    private final boolean      alwaysLogTranscript;
    private final int          transcriptIndent;
    private final String       directivePackage;  // null = no extension scanning

    private CaseRunnerConfig(Builder b) {
        this.shell               = List.copyOf(b.shell);
        this.outputCharset       = b.outputCharset;
        this.alwaysLogTranscript = b.alwaysLogTranscript;
        this.transcriptIndent    = b.transcriptIndent;
        this.directivePackage    = b.directivePackage;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static CaseRunnerConfig defaults() {
        return builder().build();
    }

    public static CaseRunnerConfig fromEnvironment() {
        return builder()
            .shell(shellEnvOrDefault("CASERUNNER_SHELL", DEFAULT_SHELL))
            .outputCharset(charsetEnvOrDefault("CASERUNNER_CHARSET", StandardCharsets.UTF_8))
            .alwaysLogTranscript(boolEnvOrDefault("CASERUNNER_ALWAYS_LOG_TRANSCRIPT", false))
            .transcriptIndent(intEnvOrDefault("CASERUNNER_TRANSCRIPT_INDENT", DEFAULT_TRANSCRIPT_INDENT))
            .directivePackage(envOrDefault("CASERUNNER_DIRECTIVE_PACKAGE", null))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public List<String> getShell()              { return shell; }
    public Charset      getOutputCharset()      { return outputCharset; }
    public boolean      isAlwaysLogTranscript() { return alwaysLogTranscript; }
    public int          getTranscriptIndent()   { return transcriptIndent; }
    public String       getDirectivePackage()   { return directivePackage; }
    public boolean      isExtensionScanEnabled() { return directivePackage != null; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private List<String> shell = DEFAULT_SHELL;
        private Charset outputCharset = StandardCharsets.UTF_8;
        private boolean alwaysLogTranscript = false;
        private int transcriptIndent = DEFAULT_TRANSCRIPT_INDENT;
        private String directivePackage = null;

        public Builder shell(List<String> shell)           { this.shell = shell; return this; }
        public Builder outputCharset(Charset c)            { this.outputCharset = c; return this; }
        public Builder alwaysLogTranscript(boolean b)      { this.alwaysLogTranscript = b; return this; }
        public Builder transcriptIndent(int n)             { this.transcriptIndent = n; return this; }
        public Builder directivePackage(String pkg) {
            this.directivePackage = (pkg != null && !pkg.isBlank()) ? pkg.trim() : null;
            return this;
        }

        public CaseRunnerConfig build() {
            if (shell == null || shell.isEmpty()) {
                throw new IllegalStateException("CaseRunnerConfig: shell prefix must not be empty");
            }
            if (transcriptIndent < 0) {
                transcriptIndent = 0;
            }
            return new CaseRunnerConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static String envOrDefault(String key, String defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? val : defaultValue;
    }

    private static int intEnvOrDefault(String key, int defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            log.warn("CaseRunnerConfig: {} is not a number, using {}", key, defaultValue);
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    private static List<String> shellEnvOrDefault(String key, List<String> defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return Arrays.asList(val.trim().split("\\s+"));
    }

    private static Charset charsetEnvOrDefault(String key, Charset defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            return Charset.forName(val.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("CaseRunnerConfig: unknown charset '{}' in {}, using {}", val, key, defaultValue);
            return defaultValue;
        }
    }
}
