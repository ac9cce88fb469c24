package com.caserunner.executor;

/**
 * Unwinds the current stage after a failed assertion.
 *
 * The failure itself has already been recorded by the time this is thrown; the
 * stage driver in {@link com.caserunner.core.TestCase} catches it and moves on
 * to the next stage. It never escapes {@code TestCase.run()}.
 *
 * Carries no stack trace.
 */
public class StageAbortException extends RuntimeException {

    public StageAbortException(String message) {
        super(message, null, false, false);
    }
}
