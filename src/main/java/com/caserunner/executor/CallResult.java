package com.caserunner.executor;

import java.util.List;

/**
 * Exit code and merged stdout/stderr of one external call.
 */
public class CallResult {

    private final int    exitCode;
    private final String output;

    public CallResult(int exitCode, String output) {
        this.exitCode = exitCode;
        this.output   = output != null ? output : "";
    }

    public int    getExitCode() { return exitCode; }
    public String getOutput()   { return output; }

    public boolean isSuccess()  { return exitCode == 0; }

    /** {@code [exitCode, output]}, the shape embedded code receives. */
    public List<Object> asList() {
        return List.of(exitCode, output);
    }

    @Override
    public String toString() {
        return String.format("CallResult{exitCode=%d, output=%d chars}", exitCode, output.length());
    }
}
