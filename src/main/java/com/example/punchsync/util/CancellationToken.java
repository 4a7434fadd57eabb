package com.example.punchsync.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between the supervisor and its workers.
 * <p>
 * Every blocking wait in the sync engine goes through {@link #await(Duration)} so that a
 * shutdown request is observed without relying on thread interruption. Callbacks
 * registered with {@link #onCancel(Runnable)} run once, on the cancelling thread, and are
 * used to abort I/O that cannot poll the token itself.
 */
public final class CancellationToken {
    private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        synchronized (latch) {
            if (latch.getCount() == 0) {
                return;
            }
            latch.countDown();
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException ex) {
                LOGGER.warn("Cancellation callback failed", ex);
            }
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return {@code true} if the token was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            return isCancelled();
        }
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Registers a callback to run when the token is cancelled. If it already is, the
     * callback runs immediately on the caller's thread.
     *
     * @return a handle that unregisters the callback
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (latch) {
            if (latch.getCount() > 0) {
                callbacks.add(callback);
                return () -> callbacks.remove(callback);
            }
        }
        callback.run();
        return () -> {
        };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
