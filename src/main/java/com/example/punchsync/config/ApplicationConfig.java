package com.example.punchsync.config;

import com.example.punchsync.model.DeviceConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Root configuration object that mirrors the structure of the YAML configuration file.
 */
public class ApplicationConfig {
    private List<DeviceSettings> devices = new ArrayList<>();
    private DatabaseConfig database = new DatabaseConfig();
    private SyncConfig sync = new SyncConfig();

    public List<DeviceSettings> getDevices() {
        if (devices == null) {
            devices = new ArrayList<>();
        }
        return devices;
    }

    public void setDevices(List<DeviceSettings> devices) {
        this.devices = devices;
    }

    public DatabaseConfig getDatabase() {
        if (database == null) {
            database = new DatabaseConfig();
        }
        return database;
    }

    public void setDatabase(DatabaseConfig database) {
        this.database = database;
    }

    public SyncConfig getSync() {
        if (sync == null) {
            sync = new SyncConfig();
        }
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync;
    }

    /**
     * Apply default values to nested objects. This is invoked after deserialisation
     * to make sure optional sections are still initialised.
     */
    public void applyDefaults() {
        getDevices().removeIf(Objects::isNull);
        getDevices().forEach(DeviceSettings::applyDefaults);
        getDatabase().applyDefaults();
        getSync().applyDefaults();
    }

    /**
     * Checks the whole configuration and resolves the device list.
     *
     * @throws ConfigException on the first problem found
     */
    public List<DeviceConfig> validate() {
        getDatabase().validate();
        getSync().validate();
        if (getDevices().isEmpty()) {
            throw new ConfigException("At least one entry under devices is required");
        }
        List<DeviceConfig> resolved = new ArrayList<>(devices.size());
        Set<String> identities = new HashSet<>();
        for (int i = 0; i < devices.size(); i++) {
            DeviceConfig device = devices.get(i).toDeviceConfig(i);
            if (!identities.add(device.identity())) {
                throw new ConfigException("Device " + device.identity() + " is configured more than once");
            }
            resolved.add(device);
        }
        return Collections.unmodifiableList(resolved);
    }

    @Override
    public String toString() {
        return "ApplicationConfig{" +
            "devices=" + getDevices() +
            ", database=" + getDatabase() +
            ", sync=" + getSync() +
            '}';
    }

    @Override
    public int hashCode() {
        return Objects.hash(getDevices(), getDatabase(), getSync());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ApplicationConfig)) {
            return false;
        }
        ApplicationConfig that = (ApplicationConfig) o;
        return Objects.equals(getDevices(), that.getDevices())
            && Objects.equals(getDatabase(), that.getDatabase())
            && Objects.equals(getSync(), that.getSync());
    }
}
