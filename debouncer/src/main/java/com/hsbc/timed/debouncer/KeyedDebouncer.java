package com.hsbc.timed.debouncer;

import com.hsbc.timed.outcome.CallbackFailureHandler;
import com.hsbc.timed.outcome.OutcomeCallbacks;
import com.hsbc.timed.outcome.OutcomeDispatcher;
import com.hsbc.timed.timer.Durations;
import com.hsbc.timed.timer.TimerHandle;
import com.hsbc.timed.timer.TimerTable;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe, per-key debouncer backed by a {@link ScheduledExecutorService}.
 *
 * <p>Every call registers a fresh {@link TimerHandle} for its key in a {@link TimerTable} and
 * cancels the handle it replaces. When a handle's timer fires, the handle is claimed through
 * {@link TimerTable#start(TimerHandle)}; a handle that has been replaced never runs its
 * operation. The callbacks of a started call are guarded by the handle, so a call that is
 * superseded while its asynchronous operation is still running stays silent.
 *
 * <p>The table entry for a key is removed once its call has finished, and only if no newer call
 * has replaced it in the meantime.
 *
 * @param <K> the key type
 */
public class KeyedDebouncer<K> implements Debouncer<K> {

    private static final Logger log = LoggerFactory.getLogger(KeyedDebouncer.class);

    private final Duration defaultQuietPeriod;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final OutcomeDispatcher dispatcher;
    private final TimerTable<K> timers = new TimerTable<>();
    private final AtomicBoolean isShutdown = new AtomicBoolean(false);

    public KeyedDebouncer() {
        this(DEFAULT_QUIET_PERIOD);
    }

    /**
     * @param defaultQuietPeriod the quiet period used when a call does not specify one
     */
    public KeyedDebouncer(@Nonnull Duration defaultQuietPeriod) {
        this(defaultQuietPeriod, Clock.systemUTC(), createDefaultScheduler(), CallbackFailureHandler.logging(), true);
    }

    /**
     * Creates a debouncer with a specific clock and scheduler, mainly for testing purposes. The
     * scheduler is not shut down by {@link #shutdown()}.
     */
    public KeyedDebouncer(@Nonnull Duration defaultQuietPeriod, @Nonnull Clock clock,
                          @Nonnull ScheduledExecutorService scheduler) {
        this(defaultQuietPeriod, clock, scheduler, CallbackFailureHandler.logging(), false);
    }

    public KeyedDebouncer(@Nonnull Duration defaultQuietPeriod, @Nonnull Clock clock,
                          @Nonnull ScheduledExecutorService scheduler,
                          @Nonnull CallbackFailureHandler failureHandler) {
        this(defaultQuietPeriod, clock, scheduler, failureHandler, false);
    }

    private KeyedDebouncer(Duration defaultQuietPeriod, Clock clock, ScheduledExecutorService scheduler,
                           CallbackFailureHandler failureHandler, boolean ownsScheduler) {
        this.defaultQuietPeriod = Durations.requireNotNegative(defaultQuietPeriod, "defaultQuietPeriod");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.dispatcher = new OutcomeDispatcher(scheduler, failureHandler);
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public <T> void run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                        @Nonnull OutcomeCallbacks<T> callbacks) {
        run(callId, operation, defaultQuietPeriod, callbacks);
    }

    @Override
    public <T> void run(@Nonnull K callId, @Nonnull Callable<? extends T> operation,
                        @Nonnull Duration quietPeriod, @Nonnull OutcomeCallbacks<T> callbacks) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        schedule(callId, quietPeriod, handle -> runNow(handle, operation, callbacks));
    }

    @Override
    public <T> void runAsync(@Nonnull K callId, @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
                             @Nonnull OutcomeCallbacks<T> callbacks) {
        runAsync(callId, operation, defaultQuietPeriod, callbacks);
    }

    @Override
    public <T> void runAsync(@Nonnull K callId, @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
                             @Nonnull Duration quietPeriod, @Nonnull OutcomeCallbacks<T> callbacks) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        schedule(callId, quietPeriod, handle -> startNow(handle, operation, callbacks));
    }

    private void schedule(K callId, Duration quietPeriod, Consumer<TimerHandle<K>> work) {
        Objects.requireNonNull(callId, "callId");
        Durations.requireNotNegative(quietPeriod, "quietPeriod");
        if (isShutdown.get()) {
            throw new RejectedExecutionException("Debouncer is shut down");
        }
        TimerHandle<K> handle = timers.supersede(callId, clock.instant(), quietPeriod);
        try {
            handle.attach(scheduler.schedule(() -> fire(handle, work), Durations.toDelayNanos(quietPeriod), TimeUnit.NANOSECONDS));
        } catch (RejectedExecutionException e) {
            timers.release(handle);
            handle.cancel();
            log.warn("Could not schedule debounced call for {}, possibly because the debouncer is shutting down.",
                    callId, e);
            throw e;
        }
    }

    private void fire(TimerHandle<K> handle, Consumer<TimerHandle<K>> work) {
        if (!timers.start(handle)) {
            log.debug("Debounced call for {} was superseded before it fired", handle.getKey());
            return;
        }
        work.accept(handle);
    }

    private <T> void runNow(TimerHandle<K> handle, Callable<? extends T> operation, OutcomeCallbacks<T> callbacks) {
        try {
            dispatcher.dispatchDetached(operation, callbacks.guardedBy(handle::isLive));
        } finally {
            timers.release(handle);
        }
    }

    private <T> void startNow(TimerHandle<K> handle, Callable<? extends CompletionStage<? extends T>> operation,
                              OutcomeCallbacks<T> callbacks) {
        dispatcher.dispatchAsync(operation, callbacks.guardedBy(handle::isLive), Duration.ZERO)
                .whenComplete((outcome, failure) -> timers.release(handle));
    }

    @Override
    public boolean isPending(@Nonnull K callId) {
        Objects.requireNonNull(callId, "callId");
        TimerHandle<K> handle = timers.current(callId);
        return handle != null && handle.isLive();
    }

    @Override
    public boolean cancel(@Nonnull K callId) {
        Objects.requireNonNull(callId, "callId");
        if (timers.cancel(callId) == null) {
            return false;
        }
        log.debug("Cancelled debounced call for {}", callId);
        return true;
    }

    @Override
    public int cancelAll() {
        return timers.cancelAll().size();
    }

    @Override
    public int trackedCount() {
        return timers.size();
    }

    @Override
    public void shutdown() {
        if (isShutdown.compareAndSet(false, true)) {
            int dropped = timers.cancelAll().size();
            if (dropped > 0) {
                log.debug("Dropped {} debounced calls on shutdown", dropped);
            }
            if (ownsScheduler) {
                scheduler.shutdownNow();
            }
        }
    }

    /**
     * Creates the default single-threaded scheduler that fires debounced calls.
     *
     * @return a daemon {@link ScheduledExecutorService} named {@code KeyedDebouncer-scheduler}
     */
    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "KeyedDebouncer-scheduler");
            t.setDaemon(true);
            return t;
        });
    }
}
