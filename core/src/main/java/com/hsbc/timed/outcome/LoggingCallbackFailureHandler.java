package com.hsbc.timed.outcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingCallbackFailureHandler implements CallbackFailureHandler {

    static final LoggingCallbackFailureHandler INSTANCE = new LoggingCallbackFailureHandler();

    private static final Logger log = LoggerFactory.getLogger(LoggingCallbackFailureHandler.class);

    private LoggingCallbackFailureHandler() {
    }

    @Override
    public void handle(TimedOperationException failure) {
        log.error("{} callback failed outside the calling thread", failure.getOutcomeKind(), failure.getCause());
    }
}
