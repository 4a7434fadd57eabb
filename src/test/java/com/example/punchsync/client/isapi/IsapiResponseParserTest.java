package com.example.punchsync.client.isapi;

import com.example.punchsync.client.DeviceProtocolException;
import com.example.punchsync.model.RawRecord;
import com.example.punchsync.model.UserRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IsapiResponseParserTest {

    private final IsapiResponseParser parser = new IsapiResponseParser();

    @Test
    void parsesSerialFromXmlDeviceInfo() throws Exception {
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<DeviceInfo><deviceName>Lobby</deviceName><serialNumber> DS-K1T671-0001 </serialNumber></DeviceInfo>";
        assertEquals(Optional.of("DS-K1T671-0001"), parser.parseSerialNumber(xml));
    }

    @Test
    void parsesSerialFromJsonDeviceInfo() throws Exception {
        assertEquals(Optional.of("ABC"), parser.parseSerialNumber("{\"DeviceInfo\":{\"serialNumber\":\"ABC\"}}"));
        assertEquals(Optional.empty(), parser.parseSerialNumber("{\"DeviceInfo\":{}}"));
    }

    @Test
    void emptyDeviceInfoIsAProtocolError() {
        assertThrows(DeviceProtocolException.class, () -> parser.parseSerialNumber(" "));
    }

    @Test
    void parsesEventPageAndSkipsEventsWithoutPerson() throws Exception {
        String json = "{\"AcsEvent\":{\"searchID\":\"x\",\"responseStatusStrg\":\"MORE\",\"numOfMatches\":3,\"totalMatches\":10,"
            + "\"InfoList\":["
            + "{\"major\":5,\"minor\":75,\"time\":\"2024-03-01T09:00:00+08:00\",\"employeeNoString\":\"42\",\"serialNo\":1001},"
            + "{\"major\":5,\"minor\":21,\"time\":\"2024-03-01T09:00:05+08:00\",\"serialNo\":1002},"
            + "{\"major\":5,\"minor\":75,\"time\":\"2024-03-01T09:01:00+08:00\",\"employeeNoString\":\"43\",\"serialNo\":1003}"
            + "]}}";
        IsapiResponseParser.SearchPage<RawRecord> page = parser.parseEvents(json);

        assertEquals(2, page.getItems().size());
        assertEquals(3, page.getNumMatches());
        assertEquals(10, page.getTotalMatches());
        assertTrue(page.hasMore());
        RawRecord first = page.getItems().get(0);
        assertEquals(Optional.of("42"), first.getUserId());
        assertEquals(Optional.of("2024-03-01T09:00:00+08:00"), first.getTime());
        assertEquals(1001L, first.getSequence().getAsLong());
    }

    @Test
    void singleEventObjectIsAccepted() throws Exception {
        String json = "{\"AcsEvent\":{\"responseStatusStrg\":\"OK\",\"InfoList\":"
            + "{\"time\":\"2024-03-01T09:00:00+08:00\",\"employeeNoString\":\"42\"}}}";
        IsapiResponseParser.SearchPage<RawRecord> page = parser.parseEvents(json);
        assertEquals(1, page.getItems().size());
        assertFalse(page.hasMore());
        assertEquals(-1, page.getTotalMatches());
    }

    @Test
    void parsesUsers() throws Exception {
        Instant seenAt = Instant.parse("2024-03-01T00:00:00Z");
        String json = "{\"UserInfoSearch\":{\"responseStatusStrg\":\"OK\",\"numOfMatches\":3,\"totalMatches\":3,\"UserInfo\":["
            + "{\"employeeNo\":\"42\",\"name\":\"Ada\"},"
            + "{\"employeeNo\":\"43\"},"
            + "{\"name\":\"nobody\"}"
            + "]}}";
        IsapiResponseParser.SearchPage<UserRecord> page = parser.parseUsers(json, seenAt);

        assertEquals(2, page.getItems().size());
        assertEquals("42", page.getItems().get(0).getUserId());
        assertEquals("Ada", page.getItems().get(0).getDisplayName());
        assertNull(page.getItems().get(1).getDisplayName());
        assertEquals(seenAt, page.getItems().get(1).getLastSeenAt());
    }

    @Test
    void errorStatusIsAProtocolError() {
        String json = "{\"statusCode\":4,\"statusString\":\"Invalid Operation\",\"subStatusCode\":\"notSupport\"}";
        DeviceProtocolException ex = assertThrows(DeviceProtocolException.class, () -> parser.parseEvents(json));
        assertTrue(ex.getMessage().contains("notSupport"));
    }

    @Test
    void malformedJsonIsAProtocolError() {
        assertThrows(DeviceProtocolException.class, () -> parser.parseUsers("{not json", Instant.EPOCH));
    }
}
