package com.example.punchsync.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a worker's view of its device. Workers replace their snapshot on
 * every change; readers never see a partially updated value.
 */
public final class DeviceHealth {
    /**
     * Where the most recent failure came from. Storage outages are reported separately so
     * they are not mistaken for a faulty terminal.
     */
    public enum FailureKind {
        DEVICE,
        STORE,
        CRASH
    }

    private final String deviceSerial;
    private final ConnectionState state;
    private final boolean terminal;
    private final Instant lastSuccessAt;
    private final int consecutiveFailures;
    private final FailureKind lastFailureKind;
    private final String lastFailure;
    private final long persisted;
    private final long duplicates;
    private final long rejected;

    private DeviceHealth(String deviceSerial,
                         ConnectionState state,
                         boolean terminal,
                         Instant lastSuccessAt,
                         int consecutiveFailures,
                         FailureKind lastFailureKind,
                         String lastFailure,
                         long persisted,
                         long duplicates,
                         long rejected) {
        this.deviceSerial = Objects.requireNonNull(deviceSerial, "deviceSerial");
        this.state = Objects.requireNonNull(state, "state");
        this.terminal = terminal;
        this.lastSuccessAt = lastSuccessAt;
        this.consecutiveFailures = consecutiveFailures;
        this.lastFailureKind = lastFailureKind;
        this.lastFailure = lastFailure;
        this.persisted = persisted;
        this.duplicates = duplicates;
        this.rejected = rejected;
    }

    public static DeviceHealth initial(String deviceSerial) {
        return new DeviceHealth(deviceSerial, ConnectionState.DISCONNECTED, false, null, 0, null, null, 0L, 0L, 0L);
    }

    public DeviceHealth withState(ConnectionState next) {
        return new DeviceHealth(deviceSerial, next, terminal, lastSuccessAt, consecutiveFailures,
            lastFailureKind, lastFailure, persisted, duplicates, rejected);
    }

    public DeviceHealth asTerminal() {
        return new DeviceHealth(deviceSerial, ConnectionState.DISCONNECTED, true, lastSuccessAt, consecutiveFailures,
            lastFailureKind, lastFailure, persisted, duplicates, rejected);
    }

    public DeviceHealth withFailure(FailureKind kind, String message) {
        return new DeviceHealth(deviceSerial, state, terminal, lastSuccessAt, consecutiveFailures + 1,
            kind, message, persisted, duplicates, rejected);
    }

    public DeviceHealth withSuccess(Instant at, InsertOutcome outcome) {
        long nextPersisted = outcome == InsertOutcome.INSERTED ? persisted + 1 : persisted;
        long nextDuplicates = outcome == InsertOutcome.ALREADY_EXISTS ? duplicates + 1 : duplicates;
        return new DeviceHealth(deviceSerial, state, terminal, at, 0,
            lastFailureKind, lastFailure, nextPersisted, nextDuplicates, rejected);
    }

    public DeviceHealth withRejected() {
        return new DeviceHealth(deviceSerial, state, terminal, lastSuccessAt, consecutiveFailures,
            lastFailureKind, lastFailure, persisted, duplicates, rejected + 1);
    }

    public String getDeviceSerial() {
        return deviceSerial;
    }

    public ConnectionState getState() {
        return state;
    }

    /**
     * {@code true} once the worker has stopped for good.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public Optional<Instant> getLastSuccessAt() {
        return Optional.ofNullable(lastSuccessAt);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Optional<FailureKind> getLastFailureKind() {
        return Optional.ofNullable(lastFailureKind);
    }

    public Optional<String> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public long getPersisted() {
        return persisted;
    }

    public long getDuplicates() {
        return duplicates;
    }

    public long getRejected() {
        return rejected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeviceHealth)) {
            return false;
        }
        DeviceHealth that = (DeviceHealth) o;
        return terminal == that.terminal
            && consecutiveFailures == that.consecutiveFailures
            && persisted == that.persisted
            && duplicates == that.duplicates
            && rejected == that.rejected
            && deviceSerial.equals(that.deviceSerial)
            && state == that.state
            && Objects.equals(lastSuccessAt, that.lastSuccessAt)
            && lastFailureKind == that.lastFailureKind
            && Objects.equals(lastFailure, that.lastFailure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceSerial, state, terminal, lastSuccessAt, consecutiveFailures,
            lastFailureKind, lastFailure, persisted, duplicates, rejected);
    }

    @Override
    public String toString() {
        return "DeviceHealth{" +
            "deviceSerial='" + deviceSerial + '\'' +
            ", state=" + state +
            (terminal ? " (terminal)" : "") +
            ", lastSuccessAt=" + lastSuccessAt +
            ", consecutiveFailures=" + consecutiveFailures +
            ", lastFailureKind=" + lastFailureKind +
            ", persisted=" + persisted +
            ", duplicates=" + duplicates +
            ", rejected=" + rejected +
            '}';
    }
}
