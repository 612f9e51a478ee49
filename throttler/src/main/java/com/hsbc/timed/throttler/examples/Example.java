package com.hsbc.timed.throttler.examples;

import com.hsbc.timed.outcome.OutcomeCallbacks;
import com.hsbc.timed.throttler.KeyedThrottler;
import com.hsbc.timed.throttler.ThrottleResult;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public final class Example {

    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private Example() {
        // utility class
    }

    public static void main(String[] args) throws Exception {
        System.out.println("=== KeyedThrottler Demo ===");

        Duration window = Duration.ofMillis(200);
        KeyedThrottler<String> throttler = new KeyedThrottler<>(window);

        try {
            runSynchronousBurst(throttler, window);
            runAsyncWithTimeout(throttler);
        } finally {
            throttler.shutdown();
        }
    }

    private static void runSynchronousBurst(KeyedThrottler<String> throttler, Duration window)
            throws InterruptedException {
        System.out.println();
        System.out.println("--- Synchronous burst on one key ---");

        OutcomeCallbacks<Integer> callbacks = OutcomeCallbacks.<Integer>onSuccess(
                value -> System.out.printf("  search returned %d at %s%n", value, now()))
            .onThrottle(() -> System.out.printf("  search throttled at %s%n", now()));

        for (int i = 1; i <= 3; i++) {
            ThrottleResult result = throttler.run("search", () -> 42, callbacks);
            System.out.printf("Request %d -> %s%n", i, result);
        }
        ThrottleResult other = throttler.run("suggest", () -> List.of(), OutcomeCallbacks.<List<Object>>onSuccess(
                value -> System.out.println("  unexpected suggestions"))
            .onEmpty(() -> System.out.println("  no suggestions")));
        System.out.printf("Other key -> %s%n", other);

        Thread.sleep(window.toMillis() + 50);
        System.out.printf("After the window -> %s%n", throttler.run("search", () -> 43, callbacks));
    }

    private static void runAsyncWithTimeout(KeyedThrottler<String> throttler) throws Exception {
        System.out.println();
        System.out.println("--- Asynchronous call with a timeout ---");

        CompletableFuture<ThrottleResult> slow = throttler.runAsync("report",
            () -> CompletableFuture.supplyAsync(() -> "late",
                CompletableFuture.delayedExecutor(500, TimeUnit.MILLISECONDS)),
            Duration.ofSeconds(1), Duration.ofMillis(100),
            OutcomeCallbacks.<String>onSuccess(value -> System.out.println("  report: " + value))
                .onWaiting(() -> System.out.printf("  report waiting at %s%n", now()))
                .onTimeout(() -> System.out.printf("  report timed out at %s%n", now())));

        System.out.println("Result: " + slow.get(2, TimeUnit.SECONDS));
    }

    private static String now() {
        return TIME_FORMAT.format(Instant.now());
    }
}
