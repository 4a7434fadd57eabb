package com.example.punchsync.client;

import com.example.punchsync.model.UserRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * An open connection to one terminal.
 * <p>
 * Sessions are used by a single worker thread, except for {@link #disconnect()}, which may
 * be called from any thread (it is how a shutdown aborts a blocked request) and any number
 * of times.
 */
public interface DeviceSession extends AutoCloseable {

    /**
     * Serial number reported by the terminal during the handshake, if it reports one.
     */
    Optional<String> reportedSerial();

    boolean isAlive();

    List<UserRecord> listUsers() throws DeviceException;

    /**
     * Drains punches buffered on the terminal. Called once per bootstrap, possibly repeated
     * while the returned batch reports a remaining backlog.
     *
     * @param resumeFrom punches before this instant are already stored and may be skipped;
     *                   empty to drain everything the terminal still holds
     */
    HistoricalBatch fetchHistoricalRecords(Optional<Instant> resumeFrom) throws DeviceException;

    /**
     * Opens the live punch feed. A session supports a single subscription.
     */
    LiveSubscription subscribeLive() throws DeviceException;

    void disconnect();

    @Override
    default void close() {
        disconnect();
    }
}
