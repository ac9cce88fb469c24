package com.caserunner.executor;

/**
 * The case definition itself is wrong: an unknown directive, a malformed
 * argument block, a directive used where it is not available.
 *
 * Detected while adapting or dispatching a directive. It is never a runtime
 * condition of the system under test, so the stage driver reports it like any
 * other unhandled fault.
 */
public class CaseConfigException extends RuntimeException {

    public CaseConfigException(String message) {
        super(message);
    }

    public CaseConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
