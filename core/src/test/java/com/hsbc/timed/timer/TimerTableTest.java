package com.hsbc.timed.timer;

import com.hsbc.timed.testing.ManualScheduler;
import com.hsbc.timed.testing.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TimerTable Tests")
class TimerTableTest {

    private static final Instant T0 = Instant.EPOCH;
    private static final Duration WINDOW = Duration.ofMillis(500);

    private final TimerTable<String> table = new TimerTable<>();

    @Test
    @DisplayName("Should refuse a second claim while the window is active")
    void shouldRefuseClaimWithinWindow() {
        TimerHandle<String> first = table.claimIfIdle("k", T0, WINDOW);

        assertThat(first).isNotNull();
        assertThat(first.getFiresAt()).isEqualTo(T0.plus(WINDOW));
        assertThat(table.claimIfIdle("k", T0.plusMillis(499), WINDOW)).isNull();
        assertThat(table.current("k")).isSameAs(first);
    }

    @Test
    @DisplayName("Should replace an elapsed window on the next claim")
    void shouldReplaceElapsedWindow() {
        TimerHandle<String> first = table.claimIfIdle("k", T0, WINDOW);

        TimerHandle<String> second = table.claimIfIdle("k", T0.plus(WINDOW), WINDOW);

        assertThat(second).isNotNull().isNotSameAs(first);
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep keys independent")
    void shouldKeepKeysIndependent() {
        assertThat(table.claimIfIdle("a", T0, WINDOW)).isNotNull();
        assertThat(table.claimIfIdle("b", T0, WINDOW)).isNotNull();
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should cancel the handle it supersedes")
    void shouldCancelSupersededHandle() {
        TimerHandle<String> first = table.supersede("k", T0, WINDOW);

        TimerHandle<String> second = table.supersede("k", T0.plusMillis(10), WINDOW);

        assertThat(first.getState()).isEqualTo(TimerHandle.State.CANCELLED);
        assertThat(first.start()).isFalse();
        assertThat(second.isLive()).isTrue();
        assertThat(table.current("k")).isSameAs(second);
    }

    @Test
    @DisplayName("Only the handle currently registered for a key should be able to start")
    void shouldStartOnlyTheCurrentHandle() {
        TimerHandle<String> first = table.supersede("k", T0, WINDOW);
        TimerHandle<String> second = table.supersede("k", T0.plusMillis(10), WINDOW);
        TimerHandle<String> removed = table.supersede("gone", T0, WINDOW);
        table.cancel("gone");

        assertThat(table.start(first)).isFalse();
        assertThat(table.start(removed)).isFalse();
        assertThat(table.start(second)).isTrue();
        assertThat(table.start(second)).isFalse();
        assertThat(second.getState()).isEqualTo(TimerHandle.State.RUNNING);
    }

    @Test
    @DisplayName("A replaced handle should already be cancelled when its successor is visible")
    void shouldCancelReplacedHandleBeforeSuccessorIsVisible() throws InterruptedException {
        for (int i = 0; i < 200; i++) {
            TimerHandle<String> first = table.supersede("k", T0, WINDOW);
            Thread replacer = new Thread(() -> table.supersede("k", T0.plusMillis(10), WINDOW));
            replacer.start();

            TimerHandle<String> seen;
            do {
                seen = table.current("k");
            } while (seen == first);
            assertThat(first.getState()).isEqualTo(TimerHandle.State.CANCELLED);
            assertThat(table.start(first)).isFalse();

            replacer.join();
        }
    }

    @Test
    @DisplayName("A stale handle should not release its successor")
    void shouldNotReleaseSuccessor() {
        TimerHandle<String> first = table.supersede("k", T0, WINDOW);
        TimerHandle<String> second = table.supersede("k", T0, WINDOW);

        assertThat(table.release(first)).isFalse();
        assertThat(table.current("k")).isSameAs(second);
        assertThat(table.release(second)).isTrue();
        assertThat(table.size()).isZero();
    }

    @Test
    @DisplayName("Should remove and cancel handles on cancel")
    void shouldCancelHandles() {
        TimerHandle<String> a = table.supersede("a", T0, WINDOW);
        TimerHandle<String> b = table.supersede("b", T0, WINDOW);

        assertThat(table.cancel("a")).isSameAs(a);
        assertThat(table.cancel("a")).isNull();
        assertThat(a.isLive()).isFalse();

        List<TimerHandle<String>> rest = table.cancelAll();
        assertThat(rest).containsExactly(b);
        assertThat(b.isLive()).isFalse();
        assertThat(table.size()).isZero();
    }

    @Test
    @DisplayName("Handle should start at most once and report what cancel interrupted")
    void shouldTrackHandleLifecycle() {
        TimerHandle<String> pending = table.supersede("p", T0, WINDOW);
        assertThat(pending.cancel()).isEqualTo(TimerHandle.State.PENDING);

        TimerHandle<String> running = table.supersede("r", T0, WINDOW);
        assertThat(running.start()).isTrue();
        assertThat(running.start()).isFalse();
        assertThat(running.cancel()).isEqualTo(TimerHandle.State.RUNNING);
        assertThat(running.isLive()).isFalse();
    }

    @Test
    @DisplayName("Handle should report activity and remaining time against the given instant")
    void shouldReportRemainingTime() {
        TimerHandle<String> handle = table.claimIfIdle("k", T0, WINDOW);

        assertThat(handle.isActive(T0.plusMillis(200))).isTrue();
        assertThat(handle.remaining(T0.plusMillis(200))).isEqualTo(Duration.ofMillis(300));
        assertThat(handle.isActive(T0.plus(WINDOW))).isFalse();
        assertThat(handle.remaining(T0.plusSeconds(5))).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Cancelling a handle should cancel its scheduled task, even one attached late")
    void shouldCancelAttachedTask() {
        ManualScheduler scheduler = new ManualScheduler(new MutableClock());
        TimerHandle<String> handle = table.supersede("k", T0, WINDOW);
        handle.attach(scheduler.schedule(() -> { }, 500, TimeUnit.MILLISECONDS));

        handle.cancel();
        assertThat(scheduler.queuedTaskCount()).isZero();

        TimerHandle<String> late = table.supersede("late", T0, WINDOW);
        late.cancel();
        late.attach(scheduler.schedule(() -> { }, 500, TimeUnit.MILLISECONDS));
        assertThat(scheduler.queuedTaskCount()).isZero();
    }

    @Test
    @DisplayName("Durations should reject null and negative values only")
    void shouldValidateDurations() {
        assertThat(Durations.requireNotNegative(Duration.ZERO, "window")).isEqualTo(Duration.ZERO);
        assertThatThrownBy(() -> Durations.requireNotNegative(Duration.ofMillis(-1), "window"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("window must not be negative");
        assertThatThrownBy(() -> Durations.requireNotNegative(null, "window"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Delays should convert to nanoseconds and saturate instead of overflowing")
    void shouldSaturateVeryLongDelays() {
        assertThat(Durations.toDelayNanos(Duration.ofMillis(5))).isEqualTo(5_000_000L);
        assertThat(Durations.toDelayNanos(Duration.ofDays(365L * 300))).isEqualTo(Long.MAX_VALUE);
        assertThat(Durations.toDelayNanos(ChronoUnit.FOREVER.getDuration())).isEqualTo(Long.MAX_VALUE);
    }
}
