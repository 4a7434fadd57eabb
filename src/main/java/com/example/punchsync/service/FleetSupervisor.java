package com.example.punchsync.service;

import com.example.punchsync.client.DeviceDriver;
import com.example.punchsync.config.SyncConfig;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.model.DeviceHealth;
import com.example.punchsync.store.AttendanceStore;
import com.example.punchsync.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one {@link DeviceWorker} per configured device on its own thread and keeps it running.
 * <p>
 * A worker that crashes is restarted after its backoff delay; the other workers are not
 * affected. {@link #shutdown(Duration)} cancels every worker and waits for them to disconnect.
 */
public class FleetSupervisor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FleetSupervisor.class);

    private final List<DeviceWorker> workers;
    private final CancellationToken cancellation = new CancellationToken();
    private final ExecutorService workerPool;
    private final ScheduledExecutorService healthLogger;
    private final Duration healthLogInterval;
    private final AtomicBoolean started = new AtomicBoolean();

    public FleetSupervisor(List<DeviceConfig> devices, DeviceDriver driver, AttendanceStore store, SyncConfig sync) {
        this(devices, driver, store, sync, Clock.systemUTC());
    }

    public FleetSupervisor(List<DeviceConfig> devices,
                           DeviceDriver driver,
                           AttendanceStore store,
                           SyncConfig sync,
                           Clock clock) {
        Objects.requireNonNull(devices, "devices");
        if (devices.isEmpty()) {
            throw new IllegalArgumentException("At least one device is required");
        }
        List<DeviceWorker> created = new ArrayList<>(devices.size());
        for (DeviceConfig device : devices) {
            created.add(new DeviceWorker(device, driver, store, sync, cancellation, clock));
        }
        this.workers = Collections.unmodifiableList(created);
        this.healthLogInterval = sync.getHealthLogInterval();

        AtomicInteger index = new AtomicInteger();
        this.workerPool = Executors.newFixedThreadPool(workers.size(),
            r -> new Thread(r, "device-" + workers.get(index.getAndIncrement()).getDeviceId()));
        this.healthLogger = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fleet-health");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Fleet already started");
        }
        LOGGER.info("Starting sync for {} devices", workers.size());
        for (DeviceWorker worker : workers) {
            workerPool.execute(() -> supervise(worker));
        }
        long period = healthLogInterval.toMillis();
        healthLogger.scheduleAtFixedRate(this::logHealth, period, period, TimeUnit.MILLISECONDS);
    }

    /**
     * Snapshot of every worker's health, in configuration order.
     */
    public Map<String, DeviceHealth> fleetHealth() {
        Map<String, DeviceHealth> snapshot = new LinkedHashMap<>();
        for (DeviceWorker worker : workers) {
            snapshot.put(worker.getDeviceId(), worker.health());
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Cancels every worker and waits up to {@code grace} for all of them to stop.
     *
     * @return {@code true} if every worker stopped within the grace period
     */
    public boolean shutdown(Duration grace) {
        LOGGER.info("Shutting down {} device workers (grace {} ms)", workers.size(), grace.toMillis());
        cancellation.cancel();
        healthLogger.shutdownNow();
        workerPool.shutdown();
        if (started.compareAndSet(false, true)) {
            // never started: nothing will run the workers' loops
            workers.forEach(DeviceWorker::terminate);
        }
        Instant deadline = Instant.now().plus(grace);
        boolean allStopped = true;
        for (DeviceWorker worker : workers) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            try {
                if (!worker.awaitTermination(remaining)) {
                    allStopped = false;
                    LOGGER.warn("Worker for {} did not stop within the grace period (state {})",
                        worker.getDeviceId(), worker.health().getState());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                allStopped = false;
                break;
            }
        }
        if (!allStopped) {
            workerPool.shutdownNow();
        }
        logHealth();
        return allStopped;
    }

    /**
     * Blocks until every worker has reached its terminal state.
     */
    public void awaitTermination() throws InterruptedException {
        for (DeviceWorker worker : workers) {
            while (!worker.awaitTermination(Duration.ofMinutes(1))) {
                LOGGER.debug("Still waiting for worker {}", worker.getDeviceId());
            }
        }
    }

    private void supervise(DeviceWorker worker) {
        try {
            while (true) {
                try {
                    worker.run();
                    return;
                } catch (VirtualMachineError ex) {
                    LOGGER.error("Worker for {} hit a fatal error and will not be restarted", worker.getDeviceId(), ex);
                    throw ex;
                } catch (RuntimeException | Error ex) {
                    LOGGER.error("Worker for {} crashed", worker.getDeviceId(), ex);
                    if (cancellation.isCancelled()) {
                        return;
                    }
                    Duration delay = worker.recoverFromCrash(ex);
                    LOGGER.info("Restarting worker for {} in {} ms", worker.getDeviceId(), delay.toMillis());
                    if (cancellation.await(delay)) {
                        return;
                    }
                }
            }
        } finally {
            worker.terminate();
        }
    }

    private void logHealth() {
        for (DeviceWorker worker : workers) {
            DeviceHealth health = worker.health();
            LOGGER.info("Health {}: state={} persisted={} duplicates={} rejected={} failures={} lastSuccess={} lastFailure={}",
                health.getDeviceSerial(), health.getState(), health.getPersisted(), health.getDuplicates(),
                health.getRejected(), health.getConsecutiveFailures(),
                health.getLastSuccessAt().map(Instant::toString).orElse("never"),
                health.getLastFailure().orElse("none"));
        }
    }
}
