package com.example.punchsync.client;

import com.example.punchsync.model.RawRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Infinite, non-restartable feed of live punches.
 * <p>
 * {@link #next(Duration)} blocks until a punch arrives, the timeout elapses (empty result)
 * or the session's cancellation token fires (empty result). It never ends silently because
 * of a transport problem: those surface as {@link DeviceException}.
 */
public interface LiveSubscription {
    Optional<RawRecord> next(Duration timeout) throws DeviceException;
}
