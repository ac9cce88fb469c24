package com.caserunner.executor;

/**
 * A call could not even be attempted: its target did not resolve, or the
 * process could not be launched or read.
 *
 * A process that runs and exits non-zero is not a {@code CallException};
 * inspecting the exit code is left to the assertion directives.
 */
public class CallException extends RuntimeException {

    public CallException(String message) {
        super(message);
    }

    public CallException(String message, Throwable cause) {
        super(message, cause);
    }
}
