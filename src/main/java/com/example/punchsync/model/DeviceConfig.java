package com.example.punchsync.model;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one terminal, resolved from configuration at startup.
 * <p>
 * The identity is the configured serial number, or {@code address:port} when the serial is
 * not known up front.
 */
public final class DeviceConfig {
    private final String serial;
    private final String address;
    private final int port;
    private final Duration pollInterval;
    private final String username;
    private final String password;
    private final boolean https;
    private final boolean insecureTls;
    private final ZoneId timeZone;

    private DeviceConfig(Builder builder) {
        this.serial = blankToNull(builder.serial);
        this.address = Objects.requireNonNull(blankToNull(builder.address), "address");
        this.port = builder.port;
        this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
        this.username = builder.username;
        this.password = builder.password;
        this.https = builder.https;
        this.insecureTls = builder.insecureTls;
        this.timeZone = builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String identity() {
        return serial != null ? serial : address + ':' + port;
    }

    public Optional<String> getSerial() {
        return Optional.ofNullable(serial);
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean isHttps() {
        return https;
    }

    public boolean isInsecureTls() {
        return insecureTls;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    public String baseUrl() {
        return (https ? "https" : "http") + "://" + address + ':' + port;
    }

    private static String blankToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeviceConfig)) {
            return false;
        }
        DeviceConfig that = (DeviceConfig) o;
        return port == that.port
            && https == that.https
            && insecureTls == that.insecureTls
            && Objects.equals(serial, that.serial)
            && Objects.equals(address, that.address)
            && Objects.equals(pollInterval, that.pollInterval)
            && Objects.equals(username, that.username)
            && Objects.equals(password, that.password)
            && Objects.equals(timeZone, that.timeZone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serial, address, port, pollInterval, username, password, https, insecureTls, timeZone);
    }

    @Override
    public String toString() {
        return "DeviceConfig{" +
            "identity='" + identity() + '\'' +
            ", address='" + address + '\'' +
            ", port=" + port +
            ", pollInterval=" + pollInterval +
            ", username='" + username + '\'' +
            ", https=" + https +
            ", timeZone=" + timeZone +
            '}';
    }

    public static final class Builder {
        private String serial;
        private String address;
        private int port = 80;
        private Duration pollInterval = Duration.ofSeconds(2);
        private String username;
        private String password;
        private boolean https;
        private boolean insecureTls = true;
        private ZoneId timeZone;

        private Builder() {
        }

        public Builder serial(String serial) {
            this.serial = serial;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder https(boolean https) {
            this.https = https;
            return this;
        }

        public Builder insecureTls(boolean insecureTls) {
            this.insecureTls = insecureTls;
            return this;
        }

        public Builder timeZone(ZoneId timeZone) {
            this.timeZone = timeZone;
            return this;
        }

        public DeviceConfig build() {
            return new DeviceConfig(this);
        }
    }
}
