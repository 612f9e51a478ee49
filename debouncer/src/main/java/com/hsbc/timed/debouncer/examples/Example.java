package com.hsbc.timed.debouncer.examples;

import com.hsbc.timed.debouncer.KeyedDebouncer;
import com.hsbc.timed.outcome.OutcomeCallbacks;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class Example {

    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private Example() {
        // utility class
    }

    public static void main(String[] args) throws InterruptedException {
        System.out.println("=== KeyedDebouncer Demo ===");

        Duration quietPeriod = Duration.ofMillis(150);
        KeyedDebouncer<String> debouncer = new KeyedDebouncer<>(quietPeriod);

        try {
            runTypingBurst(debouncer, quietPeriod);
            runAsyncLookup(debouncer, quietPeriod);
        } finally {
            debouncer.shutdown();
        }
    }

    private static void runTypingBurst(KeyedDebouncer<String> debouncer, Duration quietPeriod)
            throws InterruptedException {
        System.out.println();
        System.out.println("--- Keystrokes on one key ---");

        CountDownLatch done = new CountDownLatch(1);
        String[] typed = {"h", "he", "hel", "hell", "hello"};
        for (String text : typed) {
            debouncer.run("typing", () -> "searched for '" + text + "'",
                OutcomeCallbacks.<String>onSuccess(result -> {
                    System.out.printf("  %s at %s%n", result, now());
                    done.countDown();
                }));
            System.out.printf("Typed '%s' at %s%n", text, now());
            Thread.sleep(quietPeriod.toMillis() / 3);
        }

        boolean completed = done.await(quietPeriod.toMillis() * 4, TimeUnit.MILLISECONDS);
        System.out.println(completed ? "Only the last keystroke ran." : "Timed out waiting for the debounced call.");
    }

    private static void runAsyncLookup(KeyedDebouncer<String> debouncer, Duration quietPeriod)
            throws InterruptedException {
        System.out.println();
        System.out.println("--- Asynchronous lookup ---");

        CountDownLatch done = new CountDownLatch(1);
        debouncer.runAsync("lookup", () -> CompletableFuture.supplyAsync(() -> (String) null),
            OutcomeCallbacks.<String>onSuccess(value -> done.countDown())
                .onWaiting(() -> System.out.printf("  lookup waiting at %s%n", now()))
                .onNull(() -> {
                    System.out.printf("  lookup found nothing at %s%n", now());
                    done.countDown();
                }));

        boolean completed = done.await(quietPeriod.toMillis() * 4, TimeUnit.MILLISECONDS);
        System.out.println(completed ? "Lookup settled." : "Timed out waiting for the lookup.");
    }

    private static String now() {
        return TIME_FORMAT.format(Instant.now());
    }
}
