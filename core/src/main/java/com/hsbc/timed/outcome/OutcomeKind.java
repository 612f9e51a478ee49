package com.hsbc.timed.outcome;

/**
 * The classification of a single operation run.
 *
 * <p>{@link #WAITING} is the only non-terminal kind: it is signalled while an asynchronous
 * operation is still pending and is always followed by one of the terminal kinds.
 */
public enum OutcomeKind {
    /** The operation returned no value ({@code null} or {@code Optional.empty()}). */
    NULL,
    /** The operation returned a collection, map, iterable or array without elements. */
    EMPTY,
    /** The operation returned a usable value. */
    SUCCESS,
    /** The operation threw, or its stage completed exceptionally. */
    ERROR,
    /** The asynchronous operation did not settle within its timeout. */
    TIMEOUT,
    /** The asynchronous operation has started and not settled yet. */
    WAITING;

    public boolean isTerminal() {
        return this != WAITING;
    }
}
