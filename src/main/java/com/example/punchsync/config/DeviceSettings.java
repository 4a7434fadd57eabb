package com.example.punchsync.config;

import com.example.punchsync.model.DeviceConfig;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * One entry of the {@code devices} list in the YAML file.
 */
public class DeviceSettings {
    private String serial;
    private String address;
    private int port = 80;
    private String username;
    private String password;
    private boolean https;
    private boolean insecureTls = true;
    private Duration pollInterval = Duration.ofSeconds(2);
    private String timeZone;

    public String getSerial() {
        return serial;
    }

    public void setSerial(String serial) {
        this.serial = serial;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isHttps() {
        return https;
    }

    public void setHttps(boolean https) {
        this.https = https;
    }

    public boolean isInsecureTls() {
        return insecureTls;
    }

    public void setInsecureTls(boolean insecureTls) {
        this.insecureTls = insecureTls;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public void applyDefaults() {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            pollInterval = Duration.ofSeconds(2);
        }
    }

    /**
     * Validates this entry and converts it into the immutable runtime form.
     *
     * @param index position in the list, used in error messages
     */
    DeviceConfig toDeviceConfig(int index) {
        String where = "devices[" + index + "]";
        if (address == null || address.trim().isEmpty()) {
            throw new ConfigException(where + ".address is required");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigException(where + ".port must be between 1 and 65535 but was " + port);
        }
        return DeviceConfig.builder()
            .serial(serial)
            .address(address)
            .port(port)
            .pollInterval(pollInterval)
            .credentials(username, password)
            .https(https)
            .insecureTls(insecureTls)
            .timeZone(resolveZone(where))
            .build();
    }

    private ZoneId resolveZone(String where) {
        if (timeZone == null || timeZone.trim().isEmpty()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException ex) {
            throw new ConfigException(where + ".timeZone is not a valid zone: " + timeZone, ex);
        }
    }

    @Override
    public String toString() {
        return "DeviceSettings{" +
            "serial='" + serial + '\'' +
            ", address='" + address + '\'' +
            ", port=" + port +
            ", username='" + username + '\'' +
            ", password=" + (password == null ? "null" : "'****'") +
            ", https=" + https +
            ", insecureTls=" + insecureTls +
            ", pollInterval=" + pollInterval +
            ", timeZone='" + timeZone + '\'' +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeviceSettings)) {
            return false;
        }
        DeviceSettings that = (DeviceSettings) o;
        return port == that.port
            && https == that.https
            && insecureTls == that.insecureTls
            && Objects.equals(serial, that.serial)
            && Objects.equals(address, that.address)
            && Objects.equals(username, that.username)
            && Objects.equals(password, that.password)
            && Objects.equals(pollInterval, that.pollInterval)
            && Objects.equals(timeZone, that.timeZone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serial, address, port, username, password, https, insecureTls, pollInterval, timeZone);
    }
}
