package com.example.punchsync.client.isapi;

import com.example.punchsync.client.DeviceConnectionException;
import com.example.punchsync.client.DeviceException;
import com.example.punchsync.client.DeviceProtocolException;
import com.example.punchsync.client.DeviceSession;
import com.example.punchsync.client.HistoricalBatch;
import com.example.punchsync.client.LiveSubscription;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.model.RawRecord;
import com.example.punchsync.model.UserRecord;
import com.example.punchsync.util.CancellationToken;
import com.example.punchsync.util.DateTimes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.hc.client5.http.ClientProtocolException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.io.CloseMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One HTTP client bound to one terminal. Searches are paged with {@link PaginationPlanner};
 * the live feed polls the event search endpoint from a moving cursor.
 */
class IsapiDeviceSession implements DeviceSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(IsapiDeviceSession.class);

    static final String DEVICE_INFO_PATH = "/ISAPI/System/deviceInfo?format=json";
    static final String TIME_PATH = "/ISAPI/System/time?format=json";
    static final String USER_SEARCH_PATH = "/ISAPI/AccessControl/UserInfo/Search?format=json";
    static final String EVENT_SEARCH_PATH = "/ISAPI/AccessControl/AcsEvent?format=json";

    private static final int MAX_PAGES = 1_000;
    private static final Duration SEARCH_HORIZON = Duration.ofDays(1);

    private final DeviceConfig device;
    private final CloseableHttpClient client;
    private final IsapiResponseParser parser;
    private final CancellationToken cancellation;
    private final CancellationToken.Registration registration;
    private final int pageSize;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean subscribed = new AtomicBoolean();

    private volatile String reportedSerial;
    private Instant cursor;
    private long lastSequence = -1L;

    IsapiDeviceSession(DeviceConfig device,
                       CloseableHttpClient client,
                       IsapiResponseParser parser,
                       CancellationToken cancellation,
                       Instant historyStart,
                       int pageSize,
                       Clock clock) {
        this.device = device;
        this.client = client;
        this.parser = parser;
        this.cancellation = cancellation;
        this.pageSize = pageSize;
        this.clock = clock;
        this.cursor = historyStart;
        this.registration = cancellation.onCancel(this::disconnect);
    }

    void handshake() throws DeviceException {
        String body = execute(new HttpGet(url(DEVICE_INFO_PATH)));
        reportedSerial = parser.parseSerialNumber(body).orElse(null);
        LOGGER.info("Connected to {} (reported serial {})", device.baseUrl(), reportedSerial == null ? "n/a" : reportedSerial);
    }

    @Override
    public Optional<String> reportedSerial() {
        return Optional.ofNullable(reportedSerial);
    }

    @Override
    public boolean isAlive() {
        if (closed.get()) {
            return false;
        }
        try {
            execute(new HttpGet(url(TIME_PATH)));
            return true;
        } catch (DeviceException ex) {
            LOGGER.debug("Health check against {} failed: {}", device.baseUrl(), ex.getMessage());
            return false;
        }
    }

    @Override
    public List<UserRecord> listUsers() throws DeviceException {
        String searchId = UUID.randomUUID().toString();
        Instant seenAt = clock.instant();
        List<UserRecord> users = new ArrayList<>();
        int position = 0;
        for (int page = 0; page < MAX_PAGES; page++) {
            ObjectNode body = mapper.createObjectNode();
            ObjectNode cond = body.putObject("UserInfoSearchCond");
            cond.put("searchID", searchId);
            cond.put("searchResultPosition", position);
            cond.put("maxResults", pageSize);
            IsapiResponseParser.SearchPage<UserRecord> result = parser.parseUsers(post(USER_SEARCH_PATH, body), seenAt);
            users.addAll(result.getItems());
            OptionalInt next = PaginationPlanner.calculateNext(position, result.getNumMatches(),
                result.getTotalMatches(), pageSize, result.getStatus());
            if (next.isEmpty()) {
                return users;
            }
            position = next.getAsInt();
        }
        LOGGER.warn("User search on {} stopped after {} pages", device.baseUrl(), MAX_PAGES);
        return users;
    }

    @Override
    public HistoricalBatch fetchHistoricalRecords(Optional<Instant> resumeFrom) throws DeviceException {
        resumeFrom.filter(start -> start.isAfter(cursor)).ifPresent(start -> cursor = start);
        Instant from = cursor;
        Instant until = clock.instant().plus(SEARCH_HORIZON);
        String searchId = UUID.randomUUID().toString();
        List<RawRecord> records = new ArrayList<>();
        int position = 0;
        for (int page = 0; page < MAX_PAGES; page++) {
            IsapiResponseParser.SearchPage<RawRecord> result = searchEvents(searchId, from, until, position);
            for (RawRecord record : result.getItems()) {
                records.add(tag(record));
                advance(record, from);
            }
            OptionalInt next = PaginationPlanner.calculateNext(position, result.getNumMatches(),
                result.getTotalMatches(), pageSize, result.getStatus());
            if (next.isEmpty()) {
                return HistoricalBatch.complete(records);
            }
            position = next.getAsInt();
        }
        LOGGER.warn("Event search on {} still reports more records after {} pages", device.baseUrl(), MAX_PAGES);
        return new HistoricalBatch(records, true);
    }

    @Override
    public LiveSubscription subscribeLive() throws DeviceException {
        if (!subscribed.compareAndSet(false, true)) {
            throw new IllegalStateException("Live feed already subscribed for " + device.identity());
        }
        if (closed.get()) {
            throw new DeviceConnectionException("Session to " + device.baseUrl() + " is closed");
        }
        return new PollingSubscription();
    }

    @Override
    public void disconnect() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (registration != null) {
            registration.close();
        }
        client.close(CloseMode.IMMEDIATE);
        LOGGER.debug("Closed ISAPI session to {}", device.baseUrl());
    }

    private IsapiResponseParser.SearchPage<RawRecord> searchEvents(String searchId, Instant from, Instant until, int position)
        throws DeviceException {
        ObjectNode body = mapper.createObjectNode();
        ObjectNode cond = body.putObject("AcsEventCond");
        cond.put("searchID", searchId);
        cond.put("searchResultPosition", position);
        cond.put("maxResults", pageSize);
        cond.put("major", 0);
        cond.put("minor", 0);
        cond.put("startTime", DateTimes.toDeviceTime(from, device.getTimeZone()));
        cond.put("endTime", DateTimes.toDeviceTime(until, device.getTimeZone()));
        return parser.parseEvents(post(EVENT_SEARCH_PATH, body));
    }

    /**
     * Moves the cursor past {@code record}. Returns whether the record is newer than
     * anything seen before, either by sequence number or by a time strictly after
     * {@code floor}, the cursor as it stood before the current search (sequence numbers
     * restart when a terminal is reset).
     */
    private boolean advance(RawRecord record, Instant floor) {
        boolean fresh = false;
        OptionalLong sequence = record.getSequence();
        if (sequence.isPresent() && sequence.getAsLong() > lastSequence) {
            lastSequence = sequence.getAsLong();
            fresh = true;
        }
        Optional<Instant> time = record.getTime().flatMap(text -> DateTimes.parse(text, device.getTimeZone()));
        if (time.isPresent()) {
            if (time.get().isAfter(floor)) {
                fresh = true;
            }
            if (time.get().isAfter(cursor)) {
                cursor = time.get();
            }
        }
        return fresh;
    }

    private RawRecord tag(RawRecord record) {
        return reportedSerial == null ? record : record.withDeviceSerial(reportedSerial);
    }

    private String post(String path, ObjectNode body) throws DeviceException {
        HttpPost request = new HttpPost(url(path));
        try {
            request.setEntity(new StringEntity(mapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialise search condition", ex);
        }
        return execute(request);
    }

    private String execute(HttpUriRequestBase request) throws DeviceException {
        if (closed.get()) {
            throw new DeviceConnectionException("Session to " + device.baseUrl() + " is closed");
        }
        request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        HttpResult result;
        try {
            result = client.execute(request, response -> new HttpResult(response.getCode(),
                response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)));
        } catch (ClientProtocolException ex) {
            throw new DeviceProtocolException("Protocol error calling " + request.getRequestUri() + ": " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new DeviceConnectionException("I/O error calling " + device.baseUrl() + request.getRequestUri() + ": " + ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            // the connection pool has been shut down by disconnect()
            throw new DeviceConnectionException("Session to " + device.baseUrl() + " was closed", ex);
        }
        if (result.status == 401 || result.status == 403) {
            throw new DeviceProtocolException("Authentication rejected by " + device.baseUrl() + " (HTTP " + result.status + ")");
        }
        if (result.status >= 400) {
            throw new DeviceProtocolException("Unexpected HTTP status " + result.status + " from " + request.getRequestUri()
                + " body=" + abbreviate(result.body));
        }
        return result.body;
    }

    private String url(String path) {
        return device.baseUrl() + path;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    private static final class HttpResult {
        private final int status;
        private final String body;

        HttpResult(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }

    private final class PollingSubscription implements LiveSubscription {
        private final Deque<RawRecord> pending = new ArrayDeque<>();
        private Instant nextPollAt = clock.instant();

        @Override
        public Optional<RawRecord> next(Duration timeout) throws DeviceException {
            Instant deadline = clock.instant().plus(timeout);
            while (true) {
                if (!pending.isEmpty()) {
                    return Optional.of(pending.poll());
                }
                if (cancellation.isCancelled()) {
                    return Optional.empty();
                }
                Instant now = clock.instant();
                if (!now.isBefore(nextPollAt)) {
                    try {
                        poll();
                    } catch (DeviceException ex) {
                        // disconnect() from the cancelling thread aborts the request in flight
                        if (cancellation.isCancelled()) {
                            return Optional.empty();
                        }
                        throw ex;
                    }
                    nextPollAt = clock.instant().plus(device.getPollInterval());
                    continue;
                }
                if (!now.isBefore(deadline)) {
                    return Optional.empty();
                }
                Instant wakeAt = nextPollAt.isBefore(deadline) ? nextPollAt : deadline;
                if (cancellation.await(Duration.between(now, wakeAt))) {
                    return Optional.empty();
                }
            }
        }

        private void poll() throws DeviceException {
            Instant from = cursor;
            Instant until = clock.instant().plus(SEARCH_HORIZON);
            String searchId = UUID.randomUUID().toString();
            int position = 0;
            for (int page = 0; page < MAX_PAGES; page++) {
                IsapiResponseParser.SearchPage<RawRecord> result = searchEvents(searchId, from, until, position);
                for (RawRecord record : result.getItems()) {
                    if (advance(record, from)) {
                        pending.add(tag(record));
                    }
                }
                OptionalInt next = PaginationPlanner.calculateNext(position, result.getNumMatches(),
                    result.getTotalMatches(), pageSize, result.getStatus());
                if (next.isEmpty()) {
                    return;
                }
                position = next.getAsInt();
            }
        }
    }
}
