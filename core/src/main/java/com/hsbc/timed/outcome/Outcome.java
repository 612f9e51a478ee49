package com.hsbc.timed.outcome;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Immutable result of running an operation through an {@link OutcomeDispatcher}.
 *
 * <p>Only a {@link OutcomeKind#SUCCESS} outcome carries a value and only an
 * {@link OutcomeKind#ERROR} outcome carries a cause.
 *
 * @param <T> the type of the operation's result
 */
public final class Outcome<T> {

    private final OutcomeKind kind;
    private final T value;
    private final Throwable cause;

    private Outcome(OutcomeKind kind, @Nullable T value, @Nullable Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.cause = cause;
    }

    public static <T> Outcome<T> success(@Nonnull T value) {
        return new Outcome<>(OutcomeKind.SUCCESS, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> error(@Nonnull Throwable cause) {
        return new Outcome<>(OutcomeKind.ERROR, null, Objects.requireNonNull(cause, "cause"));
    }

    public static <T> Outcome<T> ofNull() {
        return new Outcome<>(OutcomeKind.NULL, null, null);
    }

    public static <T> Outcome<T> empty() {
        return new Outcome<>(OutcomeKind.EMPTY, null, null);
    }

    public static <T> Outcome<T> timeout() {
        return new Outcome<>(OutcomeKind.TIMEOUT, null, null);
    }

    public static <T> Outcome<T> waiting() {
        return new Outcome<>(OutcomeKind.WAITING, null, null);
    }

    public OutcomeKind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == OutcomeKind.SUCCESS;
    }

    /**
     * Returns the operation's result.
     *
     * @throws IllegalStateException if this outcome is not a success
     */
    public T getValue() {
        if (kind != OutcomeKind.SUCCESS) {
            throw new IllegalStateException("No value for outcome " + kind);
        }
        return value;
    }

    /**
     * Returns the failure of an {@link OutcomeKind#ERROR} outcome, {@code null} for any other kind.
     */
    @Nullable
    public Throwable getCause() {
        return cause;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Outcome)) {
            return false;
        }
        Outcome<?> other = (Outcome<?>) o;
        return kind == other.kind && Objects.equals(value, other.value) && Objects.equals(cause, other.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, cause);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SUCCESS:
                return "Outcome{SUCCESS, value=" + value + "}";
            case ERROR:
                return "Outcome{ERROR, cause=" + cause + "}";
            default:
                return "Outcome{" + kind + "}";
        }
    }
}
