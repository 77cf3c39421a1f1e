package com.ivamare.eventbus.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Polls a condition until it holds, for assertions on asynchronous outcomes.
 */
public final class Await {

    private Await() {
    }

    public static void until(BooleanSupplier condition) {
        until(condition, Duration.ofSeconds(5), "condition");
    }

    public static void until(BooleanSupplier condition, String description) {
        until(condition, Duration.ofSeconds(5), description);
    }

    public static void until(BooleanSupplier condition, Duration timeout, String description) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + description);
            }
        }
    }
}
