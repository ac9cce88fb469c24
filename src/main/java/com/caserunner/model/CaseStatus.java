package com.caserunner.model;

/**
 * Final verdict of a case run.
 *
 *   PASSED   -- no failures and no errors were recorded
 *   FAILED   -- at least one failure was recorded (takes precedence over errors)
 *   ERRORED  -- no failures, but at least one error was recorded
 */
public enum CaseStatus {
    PASSED,
    FAILED,
    ERRORED
}
