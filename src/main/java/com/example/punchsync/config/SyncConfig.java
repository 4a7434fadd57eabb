package com.example.punchsync.config;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Timing knobs of the sync engine. All durations are ISO-8601 strings in YAML, e.g.
 * {@code PT30S}.
 */
public class SyncConfig {
    private static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(1);
    private static final Duration DEFAULT_BACKOFF_CEILING = Duration.ofMinutes(1);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_BOOTSTRAP_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration DEFAULT_LIVE_READ_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(15);
    private static final Duration DEFAULT_HEALTH_LOG_INTERVAL = Duration.ofMinutes(1);
    private static final Instant DEFAULT_HISTORY_START = Instant.parse("2000-01-01T00:00:00Z");
    private static final int DEFAULT_HISTORY_PAGE_SIZE = 100;

    private Duration backoffBase = DEFAULT_BACKOFF_BASE;
    private Duration backoffCeiling = DEFAULT_BACKOFF_CEILING;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration bootstrapTimeout = DEFAULT_BOOTSTRAP_TIMEOUT;
    private Duration liveReadTimeout = DEFAULT_LIVE_READ_TIMEOUT;
    private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
    private Duration healthLogInterval = DEFAULT_HEALTH_LOG_INTERVAL;
    private Instant historyStart = DEFAULT_HISTORY_START;
    private int historyPageSize = DEFAULT_HISTORY_PAGE_SIZE;

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffCeiling() {
        return backoffCeiling;
    }

    public void setBackoffCeiling(Duration backoffCeiling) {
        this.backoffCeiling = backoffCeiling;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getBootstrapTimeout() {
        return bootstrapTimeout;
    }

    public void setBootstrapTimeout(Duration bootstrapTimeout) {
        this.bootstrapTimeout = bootstrapTimeout;
    }

    public Duration getLiveReadTimeout() {
        return liveReadTimeout;
    }

    public void setLiveReadTimeout(Duration liveReadTimeout) {
        this.liveReadTimeout = liveReadTimeout;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public Duration getHealthLogInterval() {
        return healthLogInterval;
    }

    public void setHealthLogInterval(Duration healthLogInterval) {
        this.healthLogInterval = healthLogInterval;
    }

    public Instant getHistoryStart() {
        return historyStart;
    }

    public void setHistoryStart(Instant historyStart) {
        this.historyStart = historyStart;
    }

    public int getHistoryPageSize() {
        return historyPageSize;
    }

    public void setHistoryPageSize(int historyPageSize) {
        this.historyPageSize = historyPageSize;
    }

    /**
     * Fills in values that were omitted from the YAML file. Explicitly invalid values are
     * left alone so {@link #validate()} can report them.
     */
    public void applyDefaults() {
        backoffBase = backoffBase == null ? DEFAULT_BACKOFF_BASE : backoffBase;
        backoffCeiling = backoffCeiling == null ? DEFAULT_BACKOFF_CEILING : backoffCeiling;
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        bootstrapTimeout = bootstrapTimeout == null ? DEFAULT_BOOTSTRAP_TIMEOUT : bootstrapTimeout;
        liveReadTimeout = liveReadTimeout == null ? DEFAULT_LIVE_READ_TIMEOUT : liveReadTimeout;
        shutdownGrace = shutdownGrace == null ? DEFAULT_SHUTDOWN_GRACE : shutdownGrace;
        healthLogInterval = healthLogInterval == null ? DEFAULT_HEALTH_LOG_INTERVAL : healthLogInterval;
        historyStart = historyStart == null ? DEFAULT_HISTORY_START : historyStart;
        if (historyPageSize <= 0) {
            historyPageSize = DEFAULT_HISTORY_PAGE_SIZE;
        }
    }

    public void validate() {
        requirePositive("sync.backoffBase", backoffBase);
        requirePositive("sync.backoffCeiling", backoffCeiling);
        requirePositive("sync.connectTimeout", connectTimeout);
        requirePositive("sync.bootstrapTimeout", bootstrapTimeout);
        requirePositive("sync.liveReadTimeout", liveReadTimeout);
        requirePositive("sync.shutdownGrace", shutdownGrace);
        requirePositive("sync.healthLogInterval", healthLogInterval);
        if (backoffCeiling.compareTo(backoffBase) < 0) {
            throw new ConfigException("sync.backoffCeiling (" + backoffCeiling + ") must not be smaller than sync.backoffBase ("
                + backoffBase + ")");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigException(name + " must be a positive duration but was " + value);
        }
    }

    @Override
    public String toString() {
        return "SyncConfig{" +
            "backoffBase=" + backoffBase +
            ", backoffCeiling=" + backoffCeiling +
            ", connectTimeout=" + connectTimeout +
            ", bootstrapTimeout=" + bootstrapTimeout +
            ", liveReadTimeout=" + liveReadTimeout +
            ", shutdownGrace=" + shutdownGrace +
            ", healthLogInterval=" + healthLogInterval +
            ", historyStart=" + historyStart +
            ", historyPageSize=" + historyPageSize +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyncConfig)) {
            return false;
        }
        SyncConfig that = (SyncConfig) o;
        return historyPageSize == that.historyPageSize
            && Objects.equals(backoffBase, that.backoffBase)
            && Objects.equals(backoffCeiling, that.backoffCeiling)
            && Objects.equals(connectTimeout, that.connectTimeout)
            && Objects.equals(bootstrapTimeout, that.bootstrapTimeout)
            && Objects.equals(liveReadTimeout, that.liveReadTimeout)
            && Objects.equals(shutdownGrace, that.shutdownGrace)
            && Objects.equals(healthLogInterval, that.healthLogInterval)
            && Objects.equals(historyStart, that.historyStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoffBase, backoffCeiling, connectTimeout, bootstrapTimeout, liveReadTimeout,
            shutdownGrace, healthLogInterval, historyStart, historyPageSize);
    }
}
