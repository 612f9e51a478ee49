package com.hsbc.timed.timer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thread-safe mapping from a caller-chosen key to at most one {@link TimerHandle}.
 *
 * <p>Each controller owns its own table. All compound operations run under a single lock, so
 * admission, replacement and removal for the same key are serialised no matter how many threads
 * touch the table. Replaced or removed handles are cancelled before the lock is released.
 * Entries are removed, not merely cancelled, once their timer is done with, so
 * a key that is no longer used stops occupying memory after one window.
 *
 * <p>The table never reads a clock; callers pass the current instant in.
 *
 * @param <K> the key type
 */
public final class TimerTable<K> {

    private final Map<K, TimerHandle<K>> handles = new HashMap<>();
    private final Object lock = new Object();

    /**
     * Registers a new handle for {@code key} unless one is still active at {@code now}. An
     * existing handle whose window has passed is replaced.
     *
     * @return the new handle, or {@code null} if the key is still inside an active window
     */
    @Nullable
    public TimerHandle<K> claimIfIdle(@Nonnull K key, @Nonnull Instant now, @Nonnull Duration window) {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            TimerHandle<K> existing = handles.get(key);
            if (existing != null && existing.isActive(now)) {
                return null;
            }
            TimerHandle<K> handle = new TimerHandle<>(key, now.plus(window));
            handles.put(key, handle);
            return handle;
        }
    }

    /**
     * Registers a new handle for {@code key} firing {@code delay} after {@code now}, cancelling
     * whatever handle was there before regardless of how much time it had left.
     *
     * @return the new handle
     */
    public TimerHandle<K> supersede(@Nonnull K key, @Nonnull Instant now, @Nonnull Duration delay) {
        Objects.requireNonNull(key, "key");
        TimerHandle<K> handle = new TimerHandle<>(key, now.plus(delay));
        synchronized (lock) {
            TimerHandle<K> previous = handles.put(key, handle);
            if (previous != null) {
                previous.cancel();
            }
        }
        return handle;
    }

    /**
     * Claims {@code handle} for running its work, provided it is still the one registered for
     * its key. Serialised with {@link #supersede}, so a handle that has been replaced can no
     * longer start.
     *
     * @return false if the handle was replaced, removed, cancelled or already started
     */
    public boolean start(@Nonnull TimerHandle<K> handle) {
        synchronized (lock) {
            return handles.get(handle.getKey()) == handle && handle.start();
        }
    }

    /**
     * Removes {@code handle} if it is still the one registered for its key. A stale handle
     * never removes its successor.
     */
    public boolean release(@Nonnull TimerHandle<K> handle) {
        synchronized (lock) {
            return handles.remove(handle.getKey(), handle);
        }
    }

    @Nullable
    public TimerHandle<K> current(@Nonnull K key) {
        synchronized (lock) {
            return handles.get(key);
        }
    }

    /**
     * Removes and cancels the handle for {@code key}.
     *
     * @return the cancelled handle, or {@code null} if there was none
     */
    @Nullable
    public TimerHandle<K> cancel(@Nonnull K key) {
        synchronized (lock) {
            TimerHandle<K> removed = handles.remove(key);
            if (removed != null) {
                removed.cancel();
            }
            return removed;
        }
    }

    /**
     * Removes and cancels every handle.
     *
     * @return the handles that were registered
     */
    public List<TimerHandle<K>> cancelAll() {
        synchronized (lock) {
            List<TimerHandle<K>> removed = new ArrayList<>(handles.values());
            handles.clear();
            for (TimerHandle<K> handle : removed) {
                handle.cancel();
            }
            return removed;
        }
    }

    public int size() {
        synchronized (lock) {
            return handles.size();
        }
    }
}
