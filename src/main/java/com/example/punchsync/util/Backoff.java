package com.example.punchsync.util;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential reconnect delay with upward jitter.
 * <p>
 * The nominal delay for the k-th consecutive failure is {@code base * 2^(k-1)}; the jitter
 * adds up to half of that again. Because the largest value for failure k is still below the
 * smallest value for failure k+1, delays never decrease as failures accumulate, while devices
 * that fail together still spread their reconnects apart. Every delay is capped at the
 * ceiling.
 */
public final class Backoff {
    private static final double MAX_JITTER = 0.5d;
    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration ceiling;
    private final Random random;

    public Backoff(Duration base, Duration ceiling) {
        this(base, ceiling, new Random());
    }

    public Backoff(Duration base, Duration ceiling, Random random) {
        this.base = Objects.requireNonNull(base, "base");
        this.ceiling = Objects.requireNonNull(ceiling, "ceiling");
        this.random = Objects.requireNonNull(random, "random");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (ceiling.compareTo(base) < 0) {
            throw new IllegalArgumentException("ceiling must not be smaller than base");
        }
    }

    public Duration delayFor(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(consecutiveFailures - 1, MAX_SHIFT);
        long nominal = saturatedShift(base.toMillis(), shift);
        long ceilingMillis = ceiling.toMillis();
        if (nominal >= ceilingMillis) {
            return ceiling;
        }
        double jitter;
        synchronized (random) {
            jitter = random.nextDouble() * MAX_JITTER;
        }
        long jittered = nominal + (long) (nominal * jitter);
        return Duration.ofMillis(Math.min(jittered, ceilingMillis));
    }

    public Duration getBase() {
        return base;
    }

    public Duration getCeiling() {
        return ceiling;
    }

    private static long saturatedShift(long value, int shift) {
        if (value > (Long.MAX_VALUE >> shift)) {
            return Long.MAX_VALUE;
        }
        return value << shift;
    }

    @Override
    public String toString() {
        return "Backoff{" +
            "base=" + base +
            ", ceiling=" + ceiling +
            '}';
    }
}
