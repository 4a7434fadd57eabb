package com.example.punchsync.client.isapi;

import com.example.punchsync.client.DeviceDriver;
import com.example.punchsync.client.DeviceException;
import com.example.punchsync.client.DeviceSession;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.util.CancellationToken;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link DeviceDriver} for Hikvision access-control terminals speaking ISAPI over HTTP.
 */
public class IsapiDeviceDriver implements DeviceDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(IsapiDeviceDriver.class);

    private final Duration connectTimeout;
    private final Duration responseTimeout;
    private final Instant historyStart;
    private final int pageSize;
    private final Clock clock;
    private final IsapiResponseParser parser = new IsapiResponseParser();

    public IsapiDeviceDriver(Duration connectTimeout, Duration responseTimeout, Instant historyStart, int pageSize) {
        this(connectTimeout, responseTimeout, historyStart, pageSize, Clock.systemUTC());
    }

    public IsapiDeviceDriver(Duration connectTimeout, Duration responseTimeout, Instant historyStart, int pageSize, Clock clock) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
        this.historyStart = Objects.requireNonNull(historyStart, "historyStart");
        this.pageSize = Math.max(pageSize, 1);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public DeviceSession connect(DeviceConfig device, CancellationToken cancellation) throws DeviceException {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(cancellation, "cancellation");
        LOGGER.debug("Opening ISAPI session to {}", device.baseUrl());
        CloseableHttpClient client = IsapiHttpClientFactory.create(device, connectTimeout, responseTimeout);
        IsapiDeviceSession session = new IsapiDeviceSession(device, client, parser, cancellation, historyStart, pageSize, clock);
        try {
            session.handshake();
            return session;
        } catch (DeviceException | RuntimeException ex) {
            session.disconnect();
            throw ex;
        }
    }
}
