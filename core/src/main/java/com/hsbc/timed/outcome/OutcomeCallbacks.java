package com.hsbc.timed.outcome;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * The set of handlers notified about a throttled or debounced call.
 *
 * <p>{@code onSuccess} is mandatory and supplied up front. Every other handler is optional and
 * defaults to a no-op. Instances are immutable; each {@code onXxx} method returns a copy with
 * that handler replaced:
 *
 * <pre>{@code
 * OutcomeCallbacks<List<Hit>> callbacks = OutcomeCallbacks.<List<Hit>>onSuccess(this::render)
 *     .onEmpty(this::showNoResults)
 *     .onError(error -> log.warn("Search failed", error))
 *     .onThrottle(() -> log.debug("Search throttled"));
 * }</pre>
 *
 * @param <T> the type of the operation's result
 */
public final class OutcomeCallbacks<T> {

    private static final Runnable NO_OP = () -> { };
    private static final Consumer<Throwable> IGNORE_ERROR = error -> { };

    private final Consumer<? super T> onSuccess;
    private final Consumer<? super Throwable> onError;
    private final Runnable onNull;
    private final Runnable onEmpty;
    private final Runnable onTimeout;
    private final Runnable onWaiting;
    private final Runnable onThrottle;

    private OutcomeCallbacks(Consumer<? super T> onSuccess, Consumer<? super Throwable> onError,
                             Runnable onNull, Runnable onEmpty, Runnable onTimeout,
                             Runnable onWaiting, Runnable onThrottle) {
        this.onSuccess = onSuccess;
        this.onError = onError;
        this.onNull = onNull;
        this.onEmpty = onEmpty;
        this.onTimeout = onTimeout;
        this.onWaiting = onWaiting;
        this.onThrottle = onThrottle;
    }

    /**
     * Creates a callback set with the given success handler and no-ops everywhere else.
     *
     * @throws NullPointerException if {@code onSuccess} is {@code null}
     */
    public static <T> OutcomeCallbacks<T> onSuccess(@Nonnull Consumer<? super T> onSuccess) {
        return new OutcomeCallbacks<>(Objects.requireNonNull(onSuccess, "onSuccess"),
                IGNORE_ERROR, NO_OP, NO_OP, NO_OP, NO_OP, NO_OP);
    }

    /**
     * Without this handler a failing operation is dropped silently.
     */
    public OutcomeCallbacks<T> onError(@Nonnull Consumer<? super Throwable> handler) {
        return new OutcomeCallbacks<>(onSuccess, Objects.requireNonNull(handler, "onError"),
                onNull, onEmpty, onTimeout, onWaiting, onThrottle);
    }

    public OutcomeCallbacks<T> onNull(@Nonnull Runnable handler) {
        return new OutcomeCallbacks<>(onSuccess, onError, Objects.requireNonNull(handler, "onNull"),
                onEmpty, onTimeout, onWaiting, onThrottle);
    }

    public OutcomeCallbacks<T> onEmpty(@Nonnull Runnable handler) {
        return new OutcomeCallbacks<>(onSuccess, onError, onNull, Objects.requireNonNull(handler, "onEmpty"),
                onTimeout, onWaiting, onThrottle);
    }

    public OutcomeCallbacks<T> onTimeout(@Nonnull Runnable handler) {
        return new OutcomeCallbacks<>(onSuccess, onError, onNull, onEmpty,
                Objects.requireNonNull(handler, "onTimeout"), onWaiting, onThrottle);
    }

    public OutcomeCallbacks<T> onWaiting(@Nonnull Runnable handler) {
        return new OutcomeCallbacks<>(onSuccess, onError, onNull, onEmpty, onTimeout,
                Objects.requireNonNull(handler, "onWaiting"), onThrottle);
    }

    /**
     * Only throttlers call this handler; debouncers never reject a call.
     */
    public OutcomeCallbacks<T> onThrottle(@Nonnull Runnable handler) {
        return new OutcomeCallbacks<>(onSuccess, onError, onNull, onEmpty, onTimeout, onWaiting,
                Objects.requireNonNull(handler, "onThrottle"));
    }

    /**
     * Returns a view that silently drops every notification once {@code live} turns false.
     */
    public OutcomeCallbacks<T> guardedBy(@Nonnull BooleanSupplier live) {
        Objects.requireNonNull(live, "live");
        return new OutcomeCallbacks<>(
                value -> {
                    if (live.getAsBoolean()) {
                        onSuccess.accept(value);
                    }
                },
                error -> {
                    if (live.getAsBoolean()) {
                        onError.accept(error);
                    }
                },
                guard(live, onNull), guard(live, onEmpty), guard(live, onTimeout),
                guard(live, onWaiting), guard(live, onThrottle));
    }

    /**
     * Invokes the single handler matching a terminal outcome.
     *
     * @throws IllegalArgumentException for a {@link OutcomeKind#WAITING} outcome
     */
    public void deliver(@Nonnull Outcome<T> outcome) {
        switch (outcome.getKind()) {
            case SUCCESS:
                onSuccess.accept(outcome.getValue());
                break;
            case ERROR:
                onError.accept(outcome.getCause());
                break;
            case NULL:
                onNull.run();
                break;
            case EMPTY:
                onEmpty.run();
                break;
            case TIMEOUT:
                onTimeout.run();
                break;
            default:
                throw new IllegalArgumentException("Not a terminal outcome: " + outcome);
        }
    }

    public void waiting() {
        onWaiting.run();
    }

    public void throttled() {
        onThrottle.run();
    }

    private static Runnable guard(BooleanSupplier live, Runnable handler) {
        return () -> {
            if (live.getAsBoolean()) {
                handler.run();
            }
        };
    }
}
