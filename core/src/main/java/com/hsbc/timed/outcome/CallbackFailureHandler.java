package com.hsbc.timed.outcome;

/**
 * Receives callback failures that happen away from the caller's thread, on a scheduler thread
 * or on whichever thread completed an asynchronous operation.
 */
@FunctionalInterface
public interface CallbackFailureHandler {

    void handle(TimedOperationException failure);

    /**
     * Returns the default handler, which logs each failure at ERROR and carries on.
     */
    static CallbackFailureHandler logging() {
        return LoggingCallbackFailureHandler.INSTANCE;
    }
}
