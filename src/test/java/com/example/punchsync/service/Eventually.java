package com.example.punchsync.service;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

final class Eventually {
    private Eventually() {
    }

    static void await(String description, BooleanSupplier condition) throws InterruptedException {
        await(description, Duration.ofSeconds(5), condition);
    }

    static void await(String description, Duration timeout, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }
}
