package com.hsbc.timed.throttler;

import com.hsbc.timed.outcome.OutcomeCallbacks;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import javax.annotation.Nonnull;

/**
 * A contract for keyed, leading-edge throttling. The first call for a key runs at once and opens
 * a cooldown window; calls for the same key inside that window are rejected, not queued.
 *
 * <p>Keys are independent: a window open for one key never affects another. Keys are chosen by
 * the caller and are not namespaced, so two unrelated call sites using the same key throttle each
 * other.
 *
 * @param <K> the key type identifying a stream of calls
 */
public interface Throttler<K> {

    /** Window used by the overloads that do not take one. */
    Duration DEFAULT_WINDOW = Duration.ofSeconds(1);

    /**
     * Runs {@code operation} now if {@code callId} is outside an active window, using the
     * throttler's default window.
     *
     * @see #run(Object, Callable, Duration, OutcomeCallbacks)
     */
    <T> ThrottleResult run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                           @Nonnull OutcomeCallbacks<T> callbacks);

    /**
     * Runs {@code operation} on the calling thread if {@code callId} is outside an active window.
     *
     * <p>When the call is accepted a new window of length {@code window} starts immediately, the
     * operation runs and the callback matching its outcome fires. When it is rejected only
     * {@code onThrottle} fires. Failures of the operation are delivered to {@code onError} and
     * never thrown; failures of a callback propagate to the caller.
     *
     * @return {@link ThrottleResult#PROCEED} if the operation ran
     * @throws IllegalArgumentException if {@code window} is negative
     * @throws java.util.concurrent.RejectedExecutionException if the throttler has been shut down
     *         or its window could not be scheduled
     */
    <T> ThrottleResult run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                           @Nonnull Duration window, @Nonnull OutcomeCallbacks<T> callbacks);

    /**
     * Asynchronous variant with the default window and no timeout.
     *
     * @see #runAsync(Object, Callable, Duration, Duration, OutcomeCallbacks)
     */
    <T> CompletableFuture<ThrottleResult> runAsync(@Nonnull K callId,
                                                   @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
                                                   @Nonnull OutcomeCallbacks<T> callbacks);

    /**
     * Starts {@code operation} if {@code callId} is outside an active window.
     *
     * <p>The window starts at call time, not when the operation completes, so a slow operation
     * can still be running when the next call for the same key is accepted. In-flight operations
     * are never cancelled.
     *
     * @param timeout how long to wait for the operation before {@code onTimeout} fires;
     *                {@link Duration#ZERO} waits forever
     * @return a future completed once the outcome callback has run, or immediately with
     *         {@link ThrottleResult#DO_NOT_PROCEED} when throttled
     */
    <T> CompletableFuture<ThrottleResult> runAsync(@Nonnull K callId,
                                                   @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
                                                   @Nonnull Duration window, @Nonnull Duration timeout,
                                                   @Nonnull OutcomeCallbacks<T> callbacks);

    /**
     * @return true if a call for {@code callId} made now would be rejected
     */
    boolean isThrottled(@Nonnull K callId);

    /**
     * @return the time left in the active window for {@code callId}, empty if there is none
     */
    Optional<Duration> remaining(@Nonnull K callId);

    /**
     * Closes the window for {@code callId} early so the next call is accepted.
     *
     * @return true if a window was open
     */
    boolean reset(@Nonnull K callId);

    /**
     * @return the number of keys currently holding a window entry
     */
    int trackedCount();

    /**
     * Shuts down the throttler and releases any underlying resources, such as threads.
     *
     * <p>After shutdown every {@code run} call throws a
     * {@link java.util.concurrent.RejectedExecutionException}. Operations already started are
     * left to finish.
     */
    void shutdown();
}
