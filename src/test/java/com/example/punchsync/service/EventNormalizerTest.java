package com.example.punchsync.service;

import com.example.punchsync.model.AttendanceEvent;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventNormalizerTest {

    private final DeviceConfig device = DeviceConfig.builder()
        .serial("DEV1")
        .address("10.0.0.5")
        .timeZone(ZoneId.of("Asia/Shanghai"))
        .build();

    private final EventNormalizer normalizer = new EventNormalizer(device);

    @Test
    void normalizesToUtcWholeSeconds() {
        AttendanceEvent event = normalizer.normalize(RawRecord.of(" 42 ", "2024-03-01T09:00:00.750+08:00"));
        assertEquals("42", event.getUserId());
        assertEquals("DEV1", event.getDeviceSerial());
        assertEquals(Instant.parse("2024-03-01T01:00:00Z"), event.getEventTime());
    }

    @Test
    void localTimeIsReadInDeviceZone() {
        AttendanceEvent event = normalizer.normalize(RawRecord.of("42", "2024-03-01 09:00:00"));
        assertEquals(Instant.parse("2024-03-01T01:00:00Z"), event.getEventTime());
    }

    @Test
    void sameMomentInDifferentNotationsIsTheSameEvent() {
        AttendanceEvent a = normalizer.normalize(RawRecord.of("42", "2024-03-01T09:00:00+08:00"));
        AttendanceEvent b = normalizer.normalize(RawRecord.of("42", "2024-03-01T01:00:00.400Z"));
        assertEquals(a, b);
    }

    @Test
    void keepsSequenceNumber() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("employeeNoString", "42");
        attributes.put("time", "2024-03-01T09:00:00+08:00");
        attributes.put("serialNo", "1207");
        AttendanceEvent event = normalizer.normalize(new RawRecord(attributes));
        assertEquals(1207L, event.getRawSequence().getAsLong());
    }

    @Test
    void rejectsMissingUser() {
        assertThrows(RecordValidationException.class, () -> normalizer.normalize(RawRecord.of("  ", "2024-03-01T09:00:00Z")));
    }

    @Test
    void rejectsUnparseableTime() {
        assertThrows(RecordValidationException.class, () -> normalizer.normalize(RawRecord.of("42", "not a time")));
        assertThrows(RecordValidationException.class, () -> normalizer.normalize(RawRecord.of("42", null)));
    }

    @Test
    void rejectsRecordFromAnotherTerminal() {
        RawRecord record = RawRecord.of("42", "2024-03-01T09:00:00Z").withDeviceSerial("DEV9");
        assertThrows(RecordValidationException.class, () -> normalizer.normalize(record));
    }

    @Test
    void serialComparisonIgnoresCase() {
        RawRecord record = RawRecord.of("42", "2024-03-01T09:00:00Z").withDeviceSerial("dev1");
        assertEquals("DEV1", normalizer.normalize(record).getDeviceSerial());
    }

    @Test
    void deviceWithoutSerialUsesAddressIdentity() {
        DeviceConfig unnamed = DeviceConfig.builder().address("10.0.0.6").port(8080).timeZone(ZoneOffset.UTC).build();
        RawRecord record = RawRecord.of("42", "2024-03-01T09:00:00Z").withDeviceSerial("WHATEVER");
        AttendanceEvent event = new EventNormalizer(unnamed).normalize(record);
        assertEquals("10.0.0.6:8080", event.getDeviceSerial());
    }
}
