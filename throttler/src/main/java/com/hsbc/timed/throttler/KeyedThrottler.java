package com.hsbc.timed.throttler;

import com.hsbc.timed.outcome.CallbackFailureHandler;
import com.hsbc.timed.outcome.OutcomeCallbacks;
import com.hsbc.timed.outcome.OutcomeDispatcher;
import com.hsbc.timed.timer.Durations;
import com.hsbc.timed.timer.TimerHandle;
import com.hsbc.timed.timer.TimerTable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe, per-key, leading-edge throttler.
 *
 * <p>Each key owns at most one cooldown window, held in a {@link TimerTable}.
 *
 * <h2>Algorithm</h2>
 * When a call for a key arrives:
 * <ol>
 *   <li>If the table holds a window for the key that has not yet ended, {@code onThrottle} fires
 *       and the operation is not run.</li>
 *   <li>Otherwise a new window ending at {@code now + window} is registered, a task is scheduled
 *       to remove it when it ends, and the operation runs through an
 *       {@link OutcomeDispatcher}.</li>
 * </ol>
 * A window whose removal task has not run yet is treated as ended as soon as the clock passes
 * its end, so lookups never depend on the scheduler being on time.
 *
 * <p>Synchronous operations run on the caller's thread. Asynchronous operations are started on
 * the caller's thread and their callbacks run on whichever thread completes them, or on the
 * scheduler thread for timeouts.
 *
 * @param <K> the key type
 */
public class KeyedThrottler<K> implements Throttler<K> {

    private static final Logger log = LoggerFactory.getLogger(KeyedThrottler.class);

    private final Duration defaultWindow;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final OutcomeDispatcher dispatcher;
    private final TimerTable<K> windows = new TimerTable<>();
    private final AtomicBoolean isShutdown = new AtomicBoolean(false);

    /**
     * Creates a throttler with a one second default window, the system clock and its own
     * scheduler thread.
     */
    public KeyedThrottler() {
        this(DEFAULT_WINDOW);
    }

    /**
     * Creates a throttler with the given default window, the system clock and its own scheduler
     * thread.
     *
     * @param defaultWindow the window used when a call does not specify one
     */
    public KeyedThrottler(@Nonnull Duration defaultWindow) {
        this(defaultWindow, Clock.systemUTC(), createDefaultScheduler(), CallbackFailureHandler.logging(), true);
    }

    /**
     * Creates a throttler with a specific clock and scheduler, mainly for testing purposes. The
     * scheduler is not shut down by {@link #shutdown()}.
     *
     * @param defaultWindow the window used when a call does not specify one
     * @param clock the clock that decides when windows end
     * @param scheduler the scheduler that removes ended windows and fires timeouts
     */
    public KeyedThrottler(@Nonnull Duration defaultWindow, @Nonnull Clock clock,
                          @Nonnull ScheduledExecutorService scheduler) {
        this(defaultWindow, clock, scheduler, CallbackFailureHandler.logging(), false);
    }

    /**
     * Creates a throttler with a specific clock, scheduler and handler for callback failures on
     * background threads.
     *
     * @param defaultWindow the window used when a call does not specify one
     * @param clock the clock that decides when windows end
     * @param scheduler the scheduler that removes ended windows and fires timeouts
     * @param failureHandler receives exceptions thrown by asynchronous callbacks
     */
    public KeyedThrottler(@Nonnull Duration defaultWindow, @Nonnull Clock clock,
                          @Nonnull ScheduledExecutorService scheduler,
                          @Nonnull CallbackFailureHandler failureHandler) {
        this(defaultWindow, clock, scheduler, failureHandler, false);
    }

    private KeyedThrottler(Duration defaultWindow, Clock clock, ScheduledExecutorService scheduler,
                           CallbackFailureHandler failureHandler, boolean ownsScheduler) {
        this.defaultWindow = Durations.requireNotNegative(defaultWindow, "defaultWindow");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.dispatcher = new OutcomeDispatcher(scheduler, failureHandler);
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public <T> ThrottleResult run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                                  @Nonnull OutcomeCallbacks<T> callbacks) {
        return run(callId, operation, defaultWindow, callbacks);
    }

    @Override
    public <T> ThrottleResult run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                                  @Nonnull Duration window, @Nonnull OutcomeCallbacks<T> callbacks) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        if (admit(callId, window) == null) {
            callbacks.throttled();
            return ThrottleResult.DO_NOT_PROCEED;
        }
        dispatcher.dispatch(operation, callbacks);
        return ThrottleResult.PROCEED;
    }

    @Override
    public <T> CompletableFuture<ThrottleResult> runAsync(
            @Nonnull K callId,
            @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
            @Nonnull OutcomeCallbacks<T> callbacks) {
        return runAsync(callId, operation, defaultWindow, Duration.ZERO, callbacks);
    }

    @Override
    public <T> CompletableFuture<ThrottleResult> runAsync(
            @Nonnull K callId,
            @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
            @Nonnull Duration window, @Nonnull Duration timeout,
            @Nonnull OutcomeCallbacks<T> callbacks) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        Durations.requireNotNegative(timeout, "timeout");
        TimerHandle<K> handle = admit(callId, window);
        if (handle == null) {
            callbacks.throttled();
            return CompletableFuture.completedFuture(ThrottleResult.DO_NOT_PROCEED);
        }
        try {
            return dispatcher.dispatchAsync(operation, callbacks, timeout)
                    .thenApply(outcome -> ThrottleResult.PROCEED);
        } catch (RejectedExecutionException e) {
            windows.release(handle);
            handle.cancel();
            log.warn("Could not schedule timeout for {}; the call was not run.", callId, e);
            throw e;
        }
    }

    /**
     * Opens a window for {@code callId} unless one is active.
     *
     * @return the new window, or {@code null} if the call must be throttled
     */
    private TimerHandle<K> admit(K callId, Duration window) {
        Objects.requireNonNull(callId, "callId");
        Durations.requireNotNegative(window, "window");
        if (isShutdown.get()) {
            throw new RejectedExecutionException("Throttler is shut down");
        }
        Instant now = clock.instant();
        TimerHandle<K> handle = windows.claimIfIdle(callId, now, window);
        if (handle == null) {
            log.debug("Throttled call for {}", callId);
            return null;
        }
        if (window.isZero()) {
            windows.release(handle);
            return handle;
        }
        try {
            handle.attach(scheduler.schedule(() -> expire(handle), Durations.toDelayNanos(window), TimeUnit.NANOSECONDS));
        } catch (RejectedExecutionException e) {
            windows.release(handle);
            handle.cancel();
            log.warn("Could not schedule the end of the window for {}, possibly because the throttler is shutting down.",
                    callId, e);
            throw e;
        }
        return handle;
    }

    private void expire(TimerHandle<K> handle) {
        if (windows.release(handle)) {
            log.debug("Window for {} ended", handle.getKey());
        }
    }

    @Override
    public boolean isThrottled(@Nonnull K callId) {
        return activeWindow(callId) != null;
    }

    @Override
    public Optional<Duration> remaining(@Nonnull K callId) {
        TimerHandle<K> handle = activeWindow(callId);
        return handle == null ? Optional.empty() : Optional.of(handle.remaining(clock.instant()));
    }

    /**
     * Returns the active window for {@code callId}, dropping it from the table if it has ended.
     */
    private TimerHandle<K> activeWindow(K callId) {
        Objects.requireNonNull(callId, "callId");
        TimerHandle<K> handle = windows.current(callId);
        if (handle == null) {
            return null;
        }
        if (handle.isActive(clock.instant())) {
            return handle;
        }
        windows.release(handle);
        return null;
    }

    @Override
    public boolean reset(@Nonnull K callId) {
        Objects.requireNonNull(callId, "callId");
        TimerHandle<K> removed = windows.cancel(callId);
        return removed != null && removed.getFiresAt().isAfter(clock.instant());
    }

    @Override
    public int trackedCount() {
        return windows.size();
    }

    /**
     * Shuts down the throttler and stops accepting new work.
     *
     * <p>Drops every open window and, if the throttler owns its scheduler, shuts it down as well.
     * Asynchronous operations already running still complete and notify their callbacks, but
     * pending timeouts no longer fire when the scheduler is owned.
     */
    @Override
    public void shutdown() {
        if (isShutdown.compareAndSet(false, true)) {
            windows.cancelAll();
            if (ownsScheduler) {
                scheduler.shutdownNow();
            }
        }
    }

    /**
     * Creates the default single-threaded scheduler used for window expiry and timeouts.
     *
     * @return a daemon {@link ScheduledExecutorService} named {@code KeyedThrottler-scheduler}
     */
    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "KeyedThrottler-scheduler");
            t.setDaemon(true);
            return t;
        });
    }
}
