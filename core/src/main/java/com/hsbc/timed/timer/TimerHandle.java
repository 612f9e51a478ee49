package com.hsbc.timed.timer;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nonnull;

/**
 * One scheduled or active timer owned by a {@link TimerTable}.
 *
 * <p>A handle starts {@link State#PENDING}. It moves to {@link State#RUNNING} when the work it
 * guards is started, or to {@link State#CANCELLED} when it is superseded or cancelled. Both
 * transitions out of {@code PENDING} are atomic, so a cancelled handle can never start and a
 * started handle reports that it could not be stopped in time.
 *
 * @param <K> the key type
 */
public final class TimerHandle<K> {

    /** Lifecycle of a handle. */
    public enum State {
        PENDING,
        RUNNING,
        CANCELLED
    }

    private final K key;
    private final Instant firesAt;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private volatile ScheduledFuture<?> timer;

    TimerHandle(@Nonnull K key, @Nonnull Instant firesAt) {
        this.key = Objects.requireNonNull(key, "key");
        this.firesAt = Objects.requireNonNull(firesAt, "firesAt");
    }

    public K getKey() {
        return key;
    }

    public Instant getFiresAt() {
        return firesAt;
    }

    public State getState() {
        return state.get();
    }

    /**
     * True while the handle's window is open: not cancelled and {@code now} is before
     * {@link #getFiresAt()}.
     */
    public boolean isActive(Instant now) {
        return isLive() && now.isBefore(firesAt);
    }

    /**
     * True until the handle is cancelled, however long ago it fired.
     */
    public boolean isLive() {
        return state.get() != State.CANCELLED;
    }

    public Duration remaining(Instant now) {
        Duration remaining = Duration.between(now, firesAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Attaches the scheduler task that fires or expires this handle. A handle cancelled before
     * the task was attached cancels the task straight away.
     */
    public void attach(@Nonnull ScheduledFuture<?> timer) {
        this.timer = Objects.requireNonNull(timer, "timer");
        if (state.get() == State.CANCELLED) {
            timer.cancel(false);
        }
    }

    /**
     * Claims the handle for running its work.
     *
     * @return false if the handle was cancelled or has already started
     */
    public boolean start() {
        return state.compareAndSet(State.PENDING, State.RUNNING);
    }

    /**
     * Cancels the handle and its scheduler task.
     *
     * @return the state the handle was in; {@link State#PENDING} means its work will never run
     */
    public State cancel() {
        State previous = state.getAndSet(State.CANCELLED);
        ScheduledFuture<?> attached = timer;
        if (attached != null) {
            attached.cancel(false);
        }
        return previous;
    }

    @Override
    public String toString() {
        return "TimerHandle{key=" + key + ", firesAt=" + firesAt + ", state=" + state.get() + "}";
    }
}
