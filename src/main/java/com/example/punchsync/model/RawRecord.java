package com.example.punchsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A punch exactly as the terminal reported it: a flat attribute map with accessors for the
 * handful of fields the normalizer needs. Nothing is validated here.
 */
public final class RawRecord {
    public static final String DEVICE_SERIAL = "deviceSerial";

    private final Map<String, String> attributes;
    private final String userId;
    private final String userName;
    private final String time;
    private final String deviceSerial;
    private final String sequence;

    public RawRecord(Map<String, String> attributes) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (attributes != null) {
            copy.putAll(attributes);
        }
        this.attributes = Collections.unmodifiableMap(copy);
        this.userId = firstNonBlank("employeeNoString", "employeeNo", "userId", "personId");
        this.userName = firstNonBlank("name", "userName");
        this.time = firstNonBlank("time", "eventTime", "dateTime", "timestamp");
        this.deviceSerial = firstNonBlank(DEVICE_SERIAL, "serialNumber");
        this.sequence = firstNonBlank("serialNo", "sequence");
    }

    public static RawRecord of(String userId, String time) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("employeeNoString", userId);
        attributes.put("time", time);
        return new RawRecord(attributes);
    }

    /**
     * Copy of this record tagged with the serial number the session reported for its device.
     */
    public RawRecord withDeviceSerial(String serial) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(DEVICE_SERIAL, serial);
        return new RawRecord(copy);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public Optional<String> getUserId() {
        return Optional.ofNullable(userId);
    }

    public Optional<String> getUserName() {
        return Optional.ofNullable(userName);
    }

    public Optional<String> getTime() {
        return Optional.ofNullable(time);
    }

    public Optional<String> getDeviceSerial() {
        return Optional.ofNullable(deviceSerial);
    }

    public OptionalLong getSequence() {
        if (sequence == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(sequence.trim()));
        } catch (NumberFormatException ex) {
            return OptionalLong.empty();
        }
    }

    private String firstNonBlank(String... keys) {
        for (String key : keys) {
            String value = attributes.get(key);
            if (value != null && !value.trim().isEmpty()) {
                return value;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawRecord)) {
            return false;
        }
        return attributes.equals(((RawRecord) o).attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return "RawRecord{" +
            "userId='" + userId + '\'' +
            ", time='" + time + '\'' +
            ", deviceSerial='" + deviceSerial + '\'' +
            ", sequence='" + sequence + '\'' +
            '}';
    }
}
