package com.caserunner.executor;

import com.caserunner.core.TestCase;

/**
 * The operation behind a directive name.
 *
 * Handlers are stateless: all per-case state (symbols, transcript, last call,
 * failures) is reached through the {@link TestCase} they are invoked for, so
 * one instance can serve every case of a run.
 *
 * <h3>Errors</h3>
 * <ul>
 *   <li>Record soft problems through {@code testCase.getAssertions()}.</li>
 *   <li>A failed assertion throws {@link StageAbortException}; let it propagate.</li>
 *   <li>Throw {@link CaseConfigException} for arguments that make no sense.</li>
 *   <li>Anything else thrown is reported as an unhandled exception of the stage.</li>
 * </ul>
 */
@FunctionalInterface
public interface DirectiveHandler {

    /**
     * @return the directive's value as seen from embedded code; may be {@code null}
     */
    Object handle(TestCase testCase, DirectiveArguments arguments);
}
