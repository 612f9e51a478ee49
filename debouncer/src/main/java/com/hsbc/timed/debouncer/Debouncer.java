package com.hsbc.timed.debouncer;

import com.hsbc.timed.outcome.OutcomeCallbacks;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import javax.annotation.Nonnull;

/**
 * A contract for keyed, trailing-edge debouncing. A call for a key is held back until the key has
 * been quiet for a given period; every new call for the same key restarts the wait and discards
 * the call it replaces.
 *
 * <p>Only the last call in a burst runs. Replaced calls never run their operation and never
 * notify any callback. Keys are independent of each other.
 *
 * @param <K> the key type identifying a stream of calls
 */
public interface Debouncer<K> {

    /** Quiet period used by the overloads that do not take one. */
    Duration DEFAULT_QUIET_PERIOD = Duration.ofSeconds(1);

    <T> void run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                 @Nonnull OutcomeCallbacks<T> callbacks);

    /**
     * Schedules {@code operation} to run once {@code callId} has been quiet for
     * {@code quietPeriod}, replacing any call still pending for that key.
     *
     * <p>The operation runs on the debouncer's scheduler thread. Its failures go to
     * {@code onError}; a failing callback is reported to the debouncer's
     * {@link com.hsbc.timed.outcome.CallbackFailureHandler}.
     *
     * @throws IllegalArgumentException if {@code quietPeriod} is negative
     * @throws java.util.concurrent.RejectedExecutionException if the debouncer has been shut
     *         down or the call could not be scheduled
     */
    <T> void run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                 @Nonnull Duration quietPeriod, @Nonnull OutcomeCallbacks<T> callbacks);

    <T> void runAsync(@Nonnull K callId, @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
                      @Nonnull OutcomeCallbacks<T> callbacks);

    /**
     * Asynchronous variant of {@link #run(Object, Callable, Duration, OutcomeCallbacks)}: the
     * operation is started on the scheduler thread when the quiet period ends and its callbacks
     * fire when the returned stage completes. If a newer call for the same key arrives while the
     * stage is still running, the stage is left to finish but its callbacks are suppressed.
     */
    <T> void runAsync(@Nonnull K callId, @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
                      @Nonnull Duration quietPeriod, @Nonnull OutcomeCallbacks<T> callbacks);

    /**
     * @return true if a call for {@code callId} is waiting to run or still running
     */
    boolean isPending(@Nonnull K callId);

    /**
     * Drops the call held for {@code callId}. A call that has not started never runs; one that is
     * running no longer notifies its callbacks.
     *
     * @return true if there was a call to drop
     */
    boolean cancel(@Nonnull K callId);

    /**
     * Drops every held call.
     *
     * @return the number of calls dropped
     */
    int cancelAll();

    /**
     * @return the number of keys with a call waiting or running
     */
    int trackedCount();

    /**
     * Drops every held call and stops accepting new ones. Later {@code run} calls throw
     * {@link java.util.concurrent.RejectedExecutionException}.
     */
    void shutdown();
}
