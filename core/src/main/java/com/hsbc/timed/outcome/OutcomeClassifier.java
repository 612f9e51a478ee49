package com.hsbc.timed.outcome;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nullable;

/**
 * Maps a raw operation result to an {@link Outcome}.
 *
 * <p>Precedence is error, then null, then empty, then success:
 * <ul>
 *   <li>{@code null} and {@code Optional.empty()} are {@link OutcomeKind#NULL}</li>
 *   <li>a {@link Collection}, {@link Map} or array with no elements is {@link OutcomeKind#EMPTY}</li>
 *   <li>any other value, including an empty {@code String}, is {@link OutcomeKind#SUCCESS}</li>
 * </ul>
 * Other {@link Iterable}s are never inspected, since some can only be iterated once.
 */
public final class OutcomeClassifier {

    private OutcomeClassifier() {
        // utility class
    }

    public static <T> Outcome<T> classify(@Nullable T result) {
        if (result == null || isEmptyOptional(result)) {
            return Outcome.ofNull();
        }
        if (hasNoElements(result)) {
            return Outcome.empty();
        }
        return Outcome.success(result);
    }

    public static <T> Outcome<T> classifyFailure(Throwable failure) {
        return Outcome.error(unwrap(failure));
    }

    /**
     * Strips the wrappers that {@code CompletableFuture} puts around the real failure.
     */
    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isEmptyOptional(Object result) {
        return result instanceof Optional && ((Optional<?>) result).isEmpty();
    }

    private static boolean hasNoElements(Object result) {
        if (result instanceof Collection) {
            return ((Collection<?>) result).isEmpty();
        }
        if (result instanceof Map) {
            return ((Map<?, ?>) result).isEmpty();
        }
        return result.getClass().isArray() && Array.getLength(result) == 0;
    }
}
