package com.example.punchsync.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Canonical punch. The natural key is (userId, deviceSerial, eventTime); it is the only
 * thing used to recognise a retransmitted punch, so {@link #equals(Object)} compares just
 * those three fields.
 */
public final class AttendanceEvent {
    private final String userId;
    private final String deviceSerial;
    private final Instant eventTime;
    private final Long rawSequence;

    public AttendanceEvent(String userId, String deviceSerial, Instant eventTime, Long rawSequence) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.deviceSerial = Objects.requireNonNull(deviceSerial, "deviceSerial");
        this.eventTime = Objects.requireNonNull(eventTime, "eventTime");
        this.rawSequence = rawSequence;
    }

    public String getUserId() {
        return userId;
    }

    public String getDeviceSerial() {
        return deviceSerial;
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public OptionalLong getRawSequence() {
        return rawSequence == null ? OptionalLong.empty() : OptionalLong.of(rawSequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttendanceEvent)) {
            return false;
        }
        AttendanceEvent that = (AttendanceEvent) o;
        return userId.equals(that.userId)
            && deviceSerial.equals(that.deviceSerial)
            && eventTime.equals(that.eventTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, deviceSerial, eventTime);
    }

    @Override
    public String toString() {
        return "AttendanceEvent{" +
            "userId='" + userId + '\'' +
            ", deviceSerial='" + deviceSerial + '\'' +
            ", eventTime=" + eventTime +
            ", rawSequence=" + rawSequence +
            '}';
    }
}
