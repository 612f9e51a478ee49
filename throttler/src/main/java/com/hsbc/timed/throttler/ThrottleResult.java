package com.hsbc.timed.throttler;

/**
 * Whether a throttled call was allowed to run.
 */
public enum ThrottleResult {
    /** The call opened a new window and its operation ran. */
    PROCEED,
    /** The key was inside an active window; the operation did not run and {@code onThrottle} fired. */
    DO_NOT_PROCEED
}
