package com.example.punchsync.service;

import com.example.punchsync.client.DeviceConnectionException;
import com.example.punchsync.client.DeviceDriver;
import com.example.punchsync.client.DeviceException;
import com.example.punchsync.client.DeviceProtocolException;
import com.example.punchsync.client.DeviceSession;
import com.example.punchsync.client.HistoricalBatch;
import com.example.punchsync.client.LiveSubscription;
import com.example.punchsync.config.SyncConfig;
import com.example.punchsync.model.AttendanceEvent;
import com.example.punchsync.model.ConnectionState;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.model.DeviceHealth;
import com.example.punchsync.model.InsertOutcome;
import com.example.punchsync.model.RawRecord;
import com.example.punchsync.model.UserRecord;
import com.example.punchsync.store.AttendanceStore;
import com.example.punchsync.store.StoreException;
import com.example.punchsync.util.Backoff;
import com.example.punchsync.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Control loop for a single terminal: connect, drain users and buffered punches, then follow
 * the live feed until something breaks, back off and start over.
 * <p>
 * Device and storage failures are handled here and never leave {@link #run()}. Anything else
 * escaping {@link #run()} is a defect; the supervisor catches it, calls
 * {@link #recoverFromCrash(Throwable)} and runs the loop again.
 * <p>
 * The health snapshot is written only by the thread running the loop.
 */
public class DeviceWorker implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeviceWorker.class);
    static final String MDC_DEVICE = "device";
    // punches sharing the latest stored second may not all have been stored yet
    static final Duration RESUME_OVERLAP = Duration.ofMinutes(1);

    private final DeviceConfig device;
    private final DeviceDriver driver;
    private final AttendanceStore store;
    private final EventNormalizer normalizer;
    private final Backoff backoff;
    private final Duration bootstrapTimeout;
    private final Duration liveReadTimeout;
    private final CancellationToken cancellation;
    private final Clock clock;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile DeviceHealth health;

    public DeviceWorker(DeviceConfig device,
                        DeviceDriver driver,
                        AttendanceStore store,
                        SyncConfig sync,
                        CancellationToken cancellation,
                        Clock clock) {
        this.device = Objects.requireNonNull(device, "device");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.store = Objects.requireNonNull(store, "store");
        this.normalizer = new EventNormalizer(device);
        this.backoff = new Backoff(sync.getBackoffBase(), sync.getBackoffCeiling());
        this.bootstrapTimeout = sync.getBootstrapTimeout();
        this.liveReadTimeout = sync.getLiveReadTimeout();
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.health = DeviceHealth.initial(device.identity());
    }

    public String getDeviceId() {
        return device.identity();
    }

    public DeviceHealth health() {
        return health;
    }

    @Override
    public void run() {
        MDC.put(MDC_DEVICE, device.identity());
        try {
            loop();
            terminate();
        } finally {
            MDC.remove(MDC_DEVICE);
        }
    }

    /**
     * Records a crash of the control loop and moves the worker to reconnecting.
     *
     * @return how long to wait before running the loop again
     */
    public Duration recoverFromCrash(Throwable crash) {
        health = health.withFailure(DeviceHealth.FailureKind.CRASH, String.valueOf(crash));
        ConnectionState state = health.getState();
        if (state != ConnectionState.RECONNECTING && state.canTransitionTo(ConnectionState.RECONNECTING)) {
            transition(ConnectionState.RECONNECTING);
        }
        return backoff.delayFor(health.getConsecutiveFailures());
    }

    /**
     * Waits for the worker to reach its terminal state.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return stopped.await(Math.max(timeout.toMillis(), 0L), TimeUnit.MILLISECONDS);
    }

    void terminate() {
        if (health.isTerminal()) {
            return;
        }
        ConnectionState previous = health.getState();
        health = health.asTerminal();
        LOGGER.info("Worker for {} stopped ({} -> {})", device.identity(), previous, ConnectionState.DISCONNECTED);
        stopped.countDown();
    }

    private void loop() {
        while (!cancellation.isCancelled()) {
            transition(ConnectionState.CONNECTING);
            DeviceSession session = null;
            try {
                session = driver.connect(device, cancellation);
                checkReportedSerial(session);
                transition(ConnectionState.BOOTSTRAPPING);
                bootstrap(session);
                if (!cancellation.isCancelled()) {
                    transition(ConnectionState.LIVE);
                    follow(session);
                }
            } catch (DeviceException ex) {
                if (!cancellation.isCancelled()) {
                    recordFailure(DeviceHealth.FailureKind.DEVICE, ex);
                    LOGGER.warn("Device {} failed: {}", device.identity(), ex.getMessage());
                }
            } catch (StoreException ex) {
                if (!cancellation.isCancelled()) {
                    recordFailure(DeviceHealth.FailureKind.STORE, ex);
                    LOGGER.warn("Storage unavailable while syncing {}: {}", device.identity(), rootMessage(ex));
                }
            } finally {
                if (session != null) {
                    session.disconnect();
                }
            }
            if (cancellation.isCancelled()) {
                return;
            }
            transition(ConnectionState.RECONNECTING);
            Duration delay = backoff.delayFor(health.getConsecutiveFailures());
            LOGGER.info("Reconnecting to {} in {} ms (consecutive failures: {})",
                device.identity(), delay.toMillis(), health.getConsecutiveFailures());
            if (cancellation.await(delay)) {
                return;
            }
        }
    }

    private void bootstrap(DeviceSession session) throws DeviceException {
        List<UserRecord> users = session.listUsers();
        for (UserRecord user : users) {
            if (cancellation.isCancelled()) {
                return;
            }
            store.upsertUser(user);
        }
        LOGGER.info("Synced {} users from {}", users.size(), device.identity());
        Optional<Instant> latest = store.latestEventTime(device.identity());
        Optional<Instant> resumeFrom = latest.map(time -> time.minus(RESUME_OVERLAP));
        LOGGER.info("Draining buffered punches from {} (latest stored punch: {})",
            device.identity(), latest.map(Instant::toString).orElse("none"));

        DeviceHealth before = health;
        int received = 0;
        Instant lastProgress = clock.instant();
        while (true) {
            HistoricalBatch batch = session.fetchHistoricalRecords(resumeFrom);
            for (RawRecord record : batch.getRecords()) {
                if (cancellation.isCancelled()) {
                    return;
                }
                persist(record);
                received++;
            }
            if (!batch.getRecords().isEmpty()) {
                lastProgress = clock.instant();
            }
            if (!batch.isBacklogRemaining()) {
                break;
            }
            if (Duration.between(lastProgress, clock.instant()).compareTo(bootstrapTimeout) > 0) {
                throw new DeviceProtocolException("Device " + device.identity() + " reports buffered punches but returned none for "
                    + bootstrapTimeout);
            }
            LOGGER.info("Device {} still reports buffered punches, draining again", device.identity());
        }
        LOGGER.info("Bootstrap of {} complete: {} records, {} stored, {} duplicates, {} rejected",
            device.identity(), received,
            health.getPersisted() - before.getPersisted(),
            health.getDuplicates() - before.getDuplicates(),
            health.getRejected() - before.getRejected());
    }

    private void follow(DeviceSession session) throws DeviceException {
        LiveSubscription subscription = session.subscribeLive();
        while (!cancellation.isCancelled()) {
            Optional<RawRecord> next = subscription.next(liveReadTimeout);
            if (next.isPresent()) {
                persist(next.get());
                continue;
            }
            if (cancellation.isCancelled()) {
                return;
            }
            if (!session.isAlive()) {
                throw new DeviceConnectionException("Device " + device.identity() + " stopped answering health checks");
            }
        }
    }

    private void persist(RawRecord record) {
        AttendanceEvent event;
        try {
            event = normalizer.normalize(record);
        } catch (RecordValidationException ex) {
            health = health.withRejected();
            LOGGER.warn("Dropped record from {}: {}", device.identity(), ex.getMessage());
            return;
        }
        InsertOutcome outcome = store.insertEventIfAbsent(event);
        health = health.withSuccess(clock.instant(), outcome);
        if (outcome == InsertOutcome.INSERTED) {
            LOGGER.info("Stored punch user={} device={} time={}", event.getUserId(), event.getDeviceSerial(), event.getEventTime());
        }
    }

    private void checkReportedSerial(DeviceSession session) {
        Optional<String> reported = session.reportedSerial();
        Optional<String> configured = device.getSerial();
        if (reported.isPresent() && configured.isPresent() && !reported.get().trim().equalsIgnoreCase(configured.get())) {
            LOGGER.warn("Device at {}:{} reports serial {} but is configured as {}; its punches will be rejected",
                device.getAddress(), device.getPort(), reported.get(), configured.get());
        }
    }

    private void recordFailure(DeviceHealth.FailureKind kind, Exception ex) {
        health = health.withFailure(kind, rootMessage(ex));
    }

    private void transition(ConnectionState next) {
        ConnectionState current = health.getState();
        if (health.isTerminal()) {
            throw new IllegalStateException("Worker for " + device.identity() + " has already stopped");
        }
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + current + " -> " + next + " for " + device.identity());
        }
        health = health.withState(next);
        LOGGER.info("Device {} state {} -> {}", device.identity(), current, next);
    }

    private static String rootMessage(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root == ex ? String.valueOf(message) : ex.getMessage() + " (" + message + ")";
    }
}
