package com.caserunner.executor;

/**
 * The thread running a case was interrupted, typically while waiting for a
 * child process.
 *
 * The only exception that escapes {@code TestCase.run()}: the case records an
 * error and rethrows so the orchestrator can stop. The thread's interrupt flag
 * is restored before this is thrown.
 */
public class CaseInterruptedException extends RuntimeException {

    public CaseInterruptedException(String message) {
        super(message);
    }

    public CaseInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
