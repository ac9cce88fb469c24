package com.caserunner.model;

/**
 * The states a {@link com.caserunner.core.TestCase} moves through, always in
 * declaration order.
 *
 *   SETUP     -- prepares resources the test relies on
 *   TEST      -- the case body; skipped when SETUP did not complete
 *   TEARDOWN  -- always reached once SETUP has started, unless an interrupt unwinds the case
 *   DONE      -- terminal; results are read-only from here on
 */
public enum Stage {
    SETUP,
    TEST,
    TEARDOWN,
    DONE
}
