package com.hsbc.timed.outcome;

import com.hsbc.timed.timer.Durations;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation exactly once, classifies what it produced and notifies the matching
 * callback.
 *
 * <h2>Synchronous dispatch</h2>
 * {@link #dispatch(Callable, OutcomeCallbacks)} runs the operation on the calling thread. Any
 * exception the operation throws becomes an {@link OutcomeKind#ERROR} outcome. An exception
 * thrown by a callback is not caught: it propagates to the caller.
 *
 * <h2>Asynchronous dispatch</h2>
 * {@link #dispatchAsync(Callable, OutcomeCallbacks, Duration)} starts the operation on the
 * calling thread and settles when its stage completes. If the stage is still pending when it is
 * returned, {@code onWaiting} fires first. With a positive timeout a timer task on the
 * dispatcher's scheduler races the stage; whichever settles first decides the outcome and the
 * loser is ignored. Callback failures on this path are wrapped in
 * {@link TimedOperationException} and handed to the {@link CallbackFailureHandler}, as they are
 * for {@link #dispatchDetached(Callable, OutcomeCallbacks)}.
 *
 * <p>Exactly one terminal callback fires per dispatch.
 */
public class OutcomeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutcomeDispatcher.class);

    private final ScheduledExecutorService scheduler;
    private final CallbackFailureHandler failureHandler;

    /**
     * @param scheduler runs timeout tasks for asynchronous dispatches
     * @param failureHandler receives callback failures raised away from the caller's thread
     */
    public OutcomeDispatcher(@Nonnull ScheduledExecutorService scheduler,
                             @Nonnull CallbackFailureHandler failureHandler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    public <T> Outcome<T> dispatch(@Nonnull Callable<? extends T> operation, @Nonnull OutcomeCallbacks<T> callbacks) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        Outcome<T> outcome = run(operation);
        callbacks.deliver(outcome);
        return outcome;
    }

    /**
     * Runs the operation on the calling thread like {@link #dispatch}, for callers that are not
     * the code that submitted it, such as a scheduler thread. A failing callback is handed to the
     * {@link CallbackFailureHandler} instead of propagating.
     */
    public <T> Outcome<T> dispatchDetached(@Nonnull Callable<? extends T> operation,
                                           @Nonnull OutcomeCallbacks<T> callbacks) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        Outcome<T> outcome = run(operation);
        deliverReporting(callbacks, outcome);
        return outcome;
    }

    /**
     * Starts an asynchronous operation and settles it against an optional timeout.
     *
     * @param timeout how long to wait for the stage; {@link Duration#ZERO} waits forever
     * @return a future completed with the terminal outcome once its callback has run; it never
     *         completes exceptionally because of the operation
     * @throws java.util.concurrent.RejectedExecutionException if the timeout cannot be
     *         scheduled, in which case the operation is not started
     */
    public <T> CompletableFuture<Outcome<T>> dispatchAsync(
            @Nonnull Callable<? extends CompletionStage<? extends T>> operation,
            @Nonnull OutcomeCallbacks<T> callbacks,
            @Nonnull Duration timeout) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        Durations.requireNotNegative(timeout, "timeout");

        Settlement<T> settlement = new Settlement<>(callbacks);
        if (!timeout.isZero()) {
            // Armed before the operation starts: a rejected timer means the operation never runs.
            settlement.timer = scheduler.schedule(() -> settle(settlement, Outcome.timeout()),
                    Durations.toDelayNanos(timeout), TimeUnit.NANOSECONDS);
        }

        CompletableFuture<? extends T> stage;
        try {
            CompletionStage<? extends T> started = operation.call();
            if (started == null) {
                settle(settlement, Outcome.error(new NullPointerException("operation returned no stage")));
                return settlement.result;
            }
            stage = started.toCompletableFuture();
        } catch (Exception e) {
            settle(settlement, OutcomeClassifier.classifyFailure(e));
            return settlement.result;
        }

        if (!stage.isDone()) {
            try {
                callbacks.waiting();
            } catch (RuntimeException e) {
                failureHandler.handle(new TimedOperationException(OutcomeKind.WAITING, e));
            }
        }
        stage.whenComplete((value, failure) -> {
            if (failure != null) {
                settle(settlement, OutcomeClassifier.classifyFailure(failure));
            } else {
                settle(settlement, OutcomeClassifier.<T>classify(value));
            }
        });
        return settlement.result;
    }

    private <T> Outcome<T> run(Callable<? extends T> operation) {
        T value;
        try {
            value = operation.call();
        } catch (Exception e) {
            log.debug("Operation failed", e);
            return OutcomeClassifier.classifyFailure(e);
        }
        return OutcomeClassifier.classify(value);
    }

    private <T> void settle(Settlement<T> settlement, Outcome<T> outcome) {
        if (!settlement.settled.compareAndSet(false, true)) {
            log.debug("Ignoring {} after the dispatch already settled", outcome.getKind());
            return;
        }
        ScheduledFuture<?> timer = settlement.timer;
        if (timer != null) {
            timer.cancel(false);
        }
        try {
            deliverReporting(settlement.callbacks, outcome);
        } finally {
            settlement.result.complete(outcome);
        }
    }

    private <T> void deliverReporting(OutcomeCallbacks<T> callbacks, Outcome<T> outcome) {
        try {
            callbacks.deliver(outcome);
        } catch (RuntimeException e) {
            failureHandler.handle(new TimedOperationException(outcome.getKind(), e));
        }
    }

    private static final class Settlement<T> {
        private final OutcomeCallbacks<T> callbacks;
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private final CompletableFuture<Outcome<T>> result = new CompletableFuture<>();
        private volatile ScheduledFuture<?> timer;

        private Settlement(OutcomeCallbacks<T> callbacks) {
            this.callbacks = callbacks;
        }
    }
}
