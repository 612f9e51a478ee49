package com.hsbc.timed.outcome;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Handed to a {@link CallbackFailureHandler} when one of the caller's own callbacks throws while
 * an outcome is delivered away from the caller's thread.
 *
 * <p>Failures of the wrapped operation itself are never reported this way; they are delivered
 * to {@code onError}.
 */
public class TimedOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final OutcomeKind outcomeKind;

    /**
     * @param outcomeKind the kind of outcome whose callback failed
     * @param cause what the callback threw
     */
    public TimedOperationException(@Nonnull OutcomeKind outcomeKind, @Nonnull Throwable cause) {
        super("Callback for " + Objects.requireNonNull(outcomeKind, "outcomeKind") + " outcome failed",
                Objects.requireNonNull(cause, "cause"));
        this.outcomeKind = outcomeKind;
    }

    /**
     * Returns the kind of outcome that was being delivered, {@link OutcomeKind#WAITING} for a
     * failed {@code onWaiting} notification.
     */
    public OutcomeKind getOutcomeKind() {
        return outcomeKind;
    }
}
