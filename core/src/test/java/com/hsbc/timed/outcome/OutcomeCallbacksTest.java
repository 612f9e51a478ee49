package com.hsbc.timed.outcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OutcomeCallbacks Tests")
class OutcomeCallbacksTest {

    private final List<String> events = new ArrayList<>();

    private OutcomeCallbacks<String> recording() {
        return OutcomeCallbacks.<String>onSuccess(value -> events.add("success:" + value))
            .onError(error -> events.add("error:" + error.getMessage()))
            .onNull(() -> events.add("null"))
            .onEmpty(() -> events.add("empty"))
            .onTimeout(() -> events.add("timeout"))
            .onWaiting(() -> events.add("waiting"))
            .onThrottle(() -> events.add("throttle"));
    }

    @Test
    @DisplayName("Each terminal outcome reaches exactly its own handler")
    void shouldDeliverToMatchingHandler() {
        OutcomeCallbacks<String> callbacks = recording();

        callbacks.deliver(Outcome.success("v"));
        callbacks.deliver(Outcome.error(new IOException("io")));
        callbacks.deliver(Outcome.ofNull());
        callbacks.deliver(Outcome.empty());
        callbacks.deliver(Outcome.timeout());
        callbacks.waiting();
        callbacks.throttled();

        assertThat(events).containsExactly("success:v", "error:io", "null", "empty", "timeout", "waiting", "throttle");
    }

    @Test
    @DisplayName("Missing optional handlers are no-ops")
    void shouldIgnoreMissingHandlers() {
        OutcomeCallbacks<String> callbacks = OutcomeCallbacks.onSuccess(value -> events.add(value));

        assertThatCode(() -> {
            callbacks.deliver(Outcome.error(new IllegalStateException("dropped")));
            callbacks.deliver(Outcome.ofNull());
            callbacks.deliver(Outcome.empty());
            callbacks.deliver(Outcome.timeout());
            callbacks.waiting();
            callbacks.throttled();
        }).doesNotThrowAnyException();
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("Success handler is mandatory")
    void shouldRequireSuccessHandler() {
        assertThatThrownBy(() -> OutcomeCallbacks.onSuccess(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("onSuccess");
        assertThatThrownBy(() -> OutcomeCallbacks.onSuccess(value -> { }).onError(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("onError");
    }

    @Test
    @DisplayName("Adding a handler returns a copy")
    void shouldBeImmutable() {
        OutcomeCallbacks<String> base = OutcomeCallbacks.onSuccess(value -> { });
        OutcomeCallbacks<String> withNull = base.onNull(() -> events.add("null"));

        base.deliver(Outcome.ofNull());
        assertThat(events).isEmpty();

        withNull.deliver(Outcome.ofNull());
        assertThat(events).containsExactly("null");
    }

    @Test
    @DisplayName("Waiting is not a deliverable outcome")
    void shouldRejectWaitingDelivery() {
        assertThatThrownBy(() -> recording().deliver(Outcome.waiting()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Guarded callbacks go silent once the guard turns false")
    void shouldSuppressWhenGuardFails() {
        AtomicBoolean live = new AtomicBoolean(true);
        OutcomeCallbacks<String> guarded = recording().guardedBy(live::get);

        guarded.deliver(Outcome.success("first"));
        live.set(false);
        guarded.deliver(Outcome.success("second"));
        guarded.deliver(Outcome.error(new IOException("late")));
        guarded.waiting();
        guarded.throttled();

        assertThat(events).containsExactly("success:first");
    }
}
