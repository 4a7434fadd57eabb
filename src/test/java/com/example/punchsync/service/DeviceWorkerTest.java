package com.example.punchsync.service;

import com.example.punchsync.config.SyncConfig;
import com.example.punchsync.model.AttendanceEvent;
import com.example.punchsync.model.ConnectionState;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.model.DeviceHealth;
import com.example.punchsync.model.RawRecord;
import com.example.punchsync.util.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DeviceWorkerTest {

    private static final String DEV = "DEV1";

    private final ScriptedDeviceDriver driver = new ScriptedDeviceDriver();
    private final InMemoryAttendanceStore store = new InMemoryAttendanceStore();
    private final CancellationToken cancellation = new CancellationToken();
    private DeviceWorker worker;
    private Thread thread;

    static SyncConfig fastSync() {
        SyncConfig sync = new SyncConfig();
        sync.setBackoffBase(Duration.ofMillis(10));
        sync.setBackoffCeiling(Duration.ofMillis(40));
        sync.setLiveReadTimeout(Duration.ofMillis(50));
        sync.setBootstrapTimeout(Duration.ofSeconds(5));
        sync.setHealthLogInterval(Duration.ofHours(1));
        sync.applyDefaults();
        return sync;
    }

    static DeviceConfig device(String serial) {
        return DeviceConfig.builder().serial(serial).address("10.0.0.5").timeZone(ZoneOffset.UTC).build();
    }

    @BeforeEach
    void setUp() {
        worker = new DeviceWorker(device(DEV), driver, store, fastSync(), cancellation, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        cancellation.cancel();
        if (thread != null) {
            thread.join(5000);
        }
    }

    private void start() {
        thread = new Thread(worker, "device-" + DEV);
        thread.start();
    }

    private void awaitState(ConnectionState state) throws InterruptedException {
        Eventually.await("state " + state, () -> worker.health().getState() == state);
    }

    @Test
    void reconnectsAfterFailuresAndResetsFailureCount() throws Exception {
        driver.failNext(DEV, 3);
        driver.sessionFor(DEV).users("42").history(RawRecord.of("42", "2024-03-01T09:00:00Z"));
        start();

        awaitState(ConnectionState.LIVE);
        DeviceHealth health = worker.health();
        assertEquals(4, driver.attempts(DEV));
        assertEquals(0, health.getConsecutiveFailures());
        assertEquals(Optional.of(DeviceHealth.FailureKind.DEVICE), health.getLastFailureKind());
        assertTrue(health.getLastSuccessAt().isPresent());
        assertEquals(1L, health.getPersisted());
        assertEquals("User 42", store.users().get("42").getDisplayName());
    }

    @Test
    void consecutiveFailuresAccumulateWhileDeviceIsDown() throws Exception {
        start();
        Eventually.await("three failures", () -> worker.health().getConsecutiveFailures() >= 3);
        assertFalse(worker.health().isTerminal());
        assertTrue(worker.health().getLastFailure().isPresent());
    }

    @Test
    void historicalDuplicatesAreStoredOnce() throws Exception {
        driver.sessionFor(DEV).history(
            RawRecord.of("42", "2024-03-01T09:00:00Z"),
            RawRecord.of("42", "2024-03-01T09:00:00.300Z"),
            RawRecord.of("43", "2024-03-01T09:01:00Z"));
        start();

        awaitState(ConnectionState.LIVE);
        assertEquals(2, store.events().size());
        assertEquals(2L, worker.health().getPersisted());
        assertEquals(1L, worker.health().getDuplicates());
    }

    @Test
    void invalidRecordsAreDroppedAndSyncContinues() throws Exception {
        driver.sessionFor(DEV).history(
            RawRecord.of("42", "not a time"),
            RawRecord.of(" ", "2024-03-01T09:00:00Z"),
            RawRecord.of("43", "2024-03-01T09:01:00Z"));
        start();

        awaitState(ConnectionState.LIVE);
        assertEquals(2L, worker.health().getRejected());
        assertEquals(1, store.events().size());
        assertEquals(0, worker.health().getConsecutiveFailures());
    }

    @Test
    void drainsAgainWhileBacklogRemains() throws Exception {
        driver.sessionFor(DEV)
            .historyWithBacklog(RawRecord.of("42", "2024-03-01T09:00:00Z"))
            .history(RawRecord.of("43", "2024-03-01T09:01:00Z"));
        start();

        awaitState(ConnectionState.LIVE);
        assertEquals(2, store.events().size());
    }

    @Test
    void firstDrainOfADeviceStartsFromTheBeginning() throws Exception {
        ScriptedDeviceDriver.ScriptedSession session = driver.sessionFor(DEV)
            .historyWithBacklog(RawRecord.of("42", "2024-03-01T09:00:00Z"))
            .history(RawRecord.of("43", "2024-03-01T09:01:00Z"));
        start();

        awaitState(ConnectionState.LIVE);
        assertEquals(List.of(Optional.empty(), Optional.empty()), session.resumePoints());
    }

    @Test
    void drainResumesShortlyBeforeLatestStoredPunch() throws Exception {
        Instant latest = Instant.parse("2024-03-01T09:00:00Z");
        store.insertEventIfAbsent(new AttendanceEvent("42", DEV, latest, null));
        store.insertEventIfAbsent(new AttendanceEvent("42", "OTHER", latest.plusSeconds(3600), null));
        ScriptedDeviceDriver.ScriptedSession session = driver.sessionFor(DEV)
            .history(RawRecord.of("42", "2024-03-01T09:00:00Z"), RawRecord.of("43", "2024-03-01T09:10:00Z"));
        start();

        awaitState(ConnectionState.LIVE);
        assertEquals(List.of(Optional.of(latest.minus(DeviceWorker.RESUME_OVERLAP))), session.resumePoints());
        assertEquals(1L, worker.health().getPersisted());
        assertEquals(1L, worker.health().getDuplicates());
    }

    @Test
    void slowDrainThatKeepsDeliveringReachesLive() throws Exception {
        SyncConfig sync = fastSync();
        sync.setBootstrapTimeout(Duration.ofMillis(100));
        worker = new DeviceWorker(device(DEV), driver, store, sync, cancellation, Clock.systemUTC());
        driver.sessionFor(DEV)
            .slowHistory(Duration.ofMillis(150))
            .historyWithBacklog(RawRecord.of("42", "2024-03-01T09:00:00Z"))
            .historyWithBacklog(RawRecord.of("43", "2024-03-01T09:01:00Z"))
            .history(RawRecord.of("44", "2024-03-01T09:02:00Z"));
        start();

        awaitState(ConnectionState.LIVE);
        assertEquals(1, driver.attempts(DEV));
        assertEquals(3, store.events().size());
        assertEquals(Optional.empty(), worker.health().getLastFailureKind());
    }

    @Test
    void backlogThatNeverDeliversIsAbandoned() throws Exception {
        SyncConfig sync = fastSync();
        sync.setBootstrapTimeout(Duration.ofMillis(100));
        worker = new DeviceWorker(device(DEV), driver, store, sync, cancellation, Clock.systemUTC());
        ScriptedDeviceDriver.ScriptedSession stuck = driver.sessionFor(DEV).slowHistory(Duration.ofMillis(40));
        for (int i = 0; i < 50; i++) {
            stuck.historyWithBacklog();
        }
        driver.sessionFor(DEV);
        start();

        Eventually.await("second connection live", () -> driver.attempts(DEV) == 2
            && worker.health().getState() == ConnectionState.LIVE);
        assertTrue(stuck.isDisconnected());
        assertEquals(Optional.of(DeviceHealth.FailureKind.DEVICE), worker.health().getLastFailureKind());
        assertTrue(worker.health().getLastFailure().orElse("").contains("returned none"));
    }

    @Test
    void livePunchesAreStored() throws Exception {
        ScriptedDeviceDriver.ScriptedSession session = driver.sessionFor(DEV);
        start();
        awaitState(ConnectionState.LIVE);

        session.push(RawRecord.of("43", "2024-03-01T09:05:00Z"));
        Eventually.await("live punch stored", () -> store.events().contains(
            new AttendanceEvent("43", DEV, Instant.parse("2024-03-01T09:05:00Z"), null)));
        assertTrue(store.users().containsKey("43"));
    }

    @Test
    void punchesFromAnotherTerminalAreRejected() throws Exception {
        ScriptedDeviceDriver.ScriptedSession session = driver.sessionFor(DEV).reportingSerial("OTHER");
        start();
        awaitState(ConnectionState.LIVE);

        session.push(RawRecord.of("43", "2024-03-01T09:05:00Z"));
        Eventually.await("record rejected", () -> worker.health().getRejected() == 1L);
        assertTrue(store.events().isEmpty());
    }

    @Test
    void silentDeviceIsReconnected() throws Exception {
        ScriptedDeviceDriver.ScriptedSession first = driver.sessionFor(DEV);
        ScriptedDeviceDriver.ScriptedSession second = driver.sessionFor(DEV);
        start();
        awaitState(ConnectionState.LIVE);

        first.die();
        Eventually.await("second connection", () -> driver.attempts(DEV) == 2
            && worker.health().getState() == ConnectionState.LIVE);
        assertTrue(first.isDisconnected());
        assertFalse(second.isDisconnected());
        assertEquals(Optional.of(DeviceHealth.FailureKind.DEVICE), worker.health().getLastFailureKind());
    }

    @Test
    void storageOutageIsRetried() throws Exception {
        store.setDown(true);
        for (int i = 0; i < 200; i++) {
            driver.sessionFor(DEV).users("42").history(RawRecord.of("42", "2024-03-01T09:00:00Z"));
        }
        start();

        Eventually.await("storage failure", () -> worker.health().getConsecutiveFailures() >= 2);
        assertEquals(Optional.of(DeviceHealth.FailureKind.STORE), worker.health().getLastFailureKind());
        assertNotEquals(ConnectionState.LIVE, worker.health().getState());
        store.setDown(false);

        awaitState(ConnectionState.LIVE);
        assertEquals(1, store.events().size());
        assertEquals(0, worker.health().getConsecutiveFailures());
    }

    @Test
    void shutdownWhileLiveStopsWithinGrace() throws Exception {
        ScriptedDeviceDriver.ScriptedSession session = driver.sessionFor(DEV);
        start();
        awaitState(ConnectionState.LIVE);

        cancellation.cancel();
        assertTrue(worker.awaitTermination(Duration.ofSeconds(2)));
        DeviceHealth health = worker.health();
        assertTrue(health.isTerminal());
        assertEquals(ConnectionState.DISCONNECTED, health.getState());
        assertTrue(session.isDisconnected());
    }

    @Test
    void shutdownDuringBackoffStopsPromptly() throws Exception {
        SyncConfig slow = fastSync();
        slow.setBackoffBase(Duration.ofMinutes(1));
        slow.setBackoffCeiling(Duration.ofMinutes(5));
        worker = new DeviceWorker(device(DEV), driver, store, slow, cancellation, Clock.systemUTC());
        start();
        awaitState(ConnectionState.RECONNECTING);

        cancellation.cancel();
        assertTrue(worker.awaitTermination(Duration.ofSeconds(2)));
        assertTrue(worker.health().isTerminal());
    }

    @Test
    void shutdownWhileConnectingStopsPromptly() throws Exception {
        driver.hangNext(DEV);
        start();
        Eventually.await("connect in progress", () -> driver.attempts(DEV) == 1);
        assertEquals(ConnectionState.CONNECTING, worker.health().getState());

        cancellation.cancel();
        assertTrue(worker.awaitTermination(Duration.ofSeconds(2)));
        assertTrue(worker.health().isTerminal());
        assertEquals(0, worker.health().getConsecutiveFailures());
    }

    @Test
    void shutdownWhileBootstrappingStopsPromptly() throws Exception {
        ScriptedDeviceDriver.ScriptedSession session = driver.sessionFor(DEV).users("42").hangInHistory();
        start();
        Eventually.await("history fetch in progress", () -> session.resumePoints().size() == 1);
        assertEquals(ConnectionState.BOOTSTRAPPING, worker.health().getState());

        cancellation.cancel();
        assertTrue(worker.awaitTermination(Duration.ofSeconds(2)));
        assertTrue(worker.health().isTerminal());
        assertTrue(session.isDisconnected());
        assertEquals(1, driver.attempts(DEV));
    }

    @Test
    void crashRecoveryCountsFailureAndReturnsDelay() {
        Duration delay = worker.recoverFromCrash(new IllegalStateException("bug"));

        DeviceHealth health = worker.health();
        assertEquals(1, health.getConsecutiveFailures());
        assertEquals(Optional.of(DeviceHealth.FailureKind.CRASH), health.getLastFailureKind());
        assertTrue(delay.compareTo(Duration.ZERO) > 0);
    }
}
