package com.example.punchsync.service;

import com.example.punchsync.model.AttendanceEvent;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.model.RawRecord;
import com.example.punchsync.util.DateTimes;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns device records into canonical punches for one configured device.
 * <p>
 * Timestamps become UTC instants truncated to whole seconds; times without an offset are
 * read in the device's configured zone. The stored device serial is always the configured
 * identity. A record that names a different serial is rejected, since that means the
 * address in the configuration points at another terminal.
 */
public final class EventNormalizer {
    private final DeviceConfig device;

    public EventNormalizer(DeviceConfig device) {
        this.device = Objects.requireNonNull(device, "device");
    }

    public AttendanceEvent normalize(RawRecord record) {
        Objects.requireNonNull(record, "record");
        String userId = record.getUserId()
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .orElseThrow(() -> new RecordValidationException("Record has no user id: " + record));
        String time = record.getTime()
            .orElseThrow(() -> new RecordValidationException("Record has no timestamp: " + record));
        Instant eventTime = DateTimes.parse(time, device.getTimeZone())
            .map(DateTimes::canonical)
            .orElseThrow(() -> new RecordValidationException("Unparseable timestamp '" + time + "' in " + record));
        checkSerial(record.getDeviceSerial());
        Long sequence = record.getSequence().isPresent() ? record.getSequence().getAsLong() : null;
        return new AttendanceEvent(userId, device.identity(), eventTime, sequence);
    }

    private void checkSerial(Optional<String> reported) {
        if (reported.isEmpty() || device.getSerial().isEmpty()) {
            return;
        }
        String actual = reported.get().trim();
        String expected = device.getSerial().get();
        if (!actual.isEmpty() && !actual.equalsIgnoreCase(expected)) {
            throw new RecordValidationException("Record reports device serial '" + actual
                + "' but " + device.getAddress() + ':' + device.getPort() + " is configured as '" + expected + "'");
        }
    }
}
