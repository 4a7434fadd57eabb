package com.example.punchsync;

import com.example.punchsync.client.isapi.IsapiDeviceDriver;
import com.example.punchsync.config.ApplicationConfig;
import com.example.punchsync.config.ConfigException;
import com.example.punchsync.config.ConfigLoader;
import com.example.punchsync.config.DatabaseConfig;
import com.example.punchsync.config.SyncConfig;
import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.service.FleetSupervisor;
import com.example.punchsync.store.AttendanceStore;
import com.example.punchsync.store.DataSourceFactory;
import com.example.punchsync.store.JdbcAttendanceStore;
import com.example.punchsync.store.SchemaInitializer;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * CLI entry point.
 */
public final class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) {
        try {
            new Main().run(args);
        } catch (ConfigException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            System.exit(1);
        } catch (Exception ex) {
            LOGGER.error("Application failed", ex);
            System.exit(1);
        }
    }

    private void run(String[] args) throws Exception {
        String command = args.length == 0 ? "run" : args[0].toLowerCase(Locale.ROOT);
        if (isHelp(command)) {
            printUsage();
            return;
        }
        ApplicationConfig config = loadConfig();
        List<DeviceConfig> devices = config.validate();
        switch (command) {
            case "run":
                executeRun(config, devices);
                break;
            case "init-schema":
                executeInitSchema(config.getDatabase());
                break;
            case "stats":
                executeStats(config.getDatabase(), devices);
                break;
            case "config":
                System.out.println(config);
                break;
            default:
                LOGGER.error("Unknown command: {}", command);
                printUsage();
        }
    }

    private void executeRun(ApplicationConfig config, List<DeviceConfig> devices) throws InterruptedException {
        DatabaseConfig database = config.getDatabase();
        SyncConfig sync = config.getSync();
        HikariDataSource dataSource = DataSourceFactory.create(database);
        if (database.isInitializeSchema()) {
            initializeSchema(dataSource);
        }
        AttendanceStore store = new JdbcAttendanceStore(dataSource, database.resolveDialect(), database.getStatementTimeout());
        IsapiDeviceDriver driver = new IsapiDeviceDriver(
            sync.getConnectTimeout(), sync.getLiveReadTimeout(), sync.getHistoryStart(), sync.getHistoryPageSize());
        FleetSupervisor supervisor = new FleetSupervisor(devices, driver, store, sync);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown requested");
            if (!supervisor.shutdown(sync.getShutdownGrace())) {
                LOGGER.warn("Some workers were still running when the grace period ended");
            }
            dataSource.close();
        }, "shutdown"));

        supervisor.start();
        supervisor.awaitTermination();
    }

    private void executeInitSchema(DatabaseConfig database) {
        try (HikariDataSource dataSource = DataSourceFactory.create(database)) {
            initializeSchema(dataSource);
        }
    }

    private void executeStats(DatabaseConfig database, List<DeviceConfig> devices) {
        try (HikariDataSource dataSource = DataSourceFactory.create(database)) {
            AttendanceStore store = new JdbcAttendanceStore(dataSource, database.resolveDialect(), database.getStatementTimeout());
            System.out.println("Total attendance records: " + store.countAttendance());
            for (DeviceConfig device : devices) {
                String id = device.identity();
                String latest = store.latestEventTime(id).map(Instant::toString).orElse("none");
                System.out.println("  " + id + ": has records=" + store.hasDeviceRecords(id) + ", latest punch=" + latest);
            }
        }
    }

    private void initializeSchema(HikariDataSource dataSource) {
        new SchemaInitializer(dataSource).ensureTables();
    }

    private ApplicationConfig loadConfig() throws IOException {
        Path path = ConfigLoader.resolvePath();
        LOGGER.info("Using configuration at {}", path.toAbsolutePath());
        return new ConfigLoader().load(path);
    }

    private boolean isHelp(String value) {
        return Arrays.asList("-h", "--help", "help").contains(value);
    }

    private void printUsage() {
        System.out.println("Usage: java -jar <jar> [run|init-schema|stats|config|help]");
        System.out.println("  run          sync every configured device until stopped (default)");
        System.out.println("  init-schema  create the users and attendance tables");
        System.out.println("  stats        print stored attendance counts per device");
        System.out.println("  config       print the effective configuration");
        System.out.println("Configuration: -Dconfig=<file>, $" + ConfigLoader.CONFIG_ENV
            + ", or " + ConfigLoader.DEFAULT_PATH);
    }
}
