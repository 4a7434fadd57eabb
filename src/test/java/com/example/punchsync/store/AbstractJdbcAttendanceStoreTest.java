package com.example.punchsync.store;

import com.example.punchsync.config.DatabaseConfig;
import com.example.punchsync.model.AttendanceEvent;
import com.example.punchsync.model.InsertOutcome;
import com.example.punchsync.model.UserRecord;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behaviour every supported database must show. Subclasses supply the connection.
 */
abstract class AbstractJdbcAttendanceStoreTest {

    static final Instant NINE = Instant.parse("2024-03-01T09:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-02T00:00:00Z");

    HikariDataSource dataSource;
    JdbcAttendanceStore store;

    abstract DatabaseConfig databaseConfig();

    @BeforeEach
    void setUp() throws SQLException {
        DatabaseConfig config = databaseConfig();
        config.applyDefaults();
        dataSource = DataSourceFactory.create(config);
        new SchemaInitializer(dataSource).ensureTables();
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM attendance");
            statement.executeUpdate("DELETE FROM users");
        }
        store = new JdbcAttendanceStore(dataSource, config.resolveDialect(), config.getStatementTimeout(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    void schemaInitializationIsRepeatable() {
        new SchemaInitializer(dataSource).ensureTables();
        assertEquals(0L, store.countAttendance());
    }

    @Test
    void secondInsertOfSameKeyIsAlreadyExists() {
        store.upsertUser(new UserRecord("42", "Ada", NOW));
        AttendanceEvent event = new AttendanceEvent("42", "DEV1", NINE, 1001L);

        assertEquals(InsertOutcome.INSERTED, store.insertEventIfAbsent(event));
        assertEquals(InsertOutcome.ALREADY_EXISTS, store.insertEventIfAbsent(event));
        assertEquals(InsertOutcome.ALREADY_EXISTS, store.insertEventIfAbsent(new AttendanceEvent("42", "DEV1", NINE, null)));
        assertEquals(1L, store.countAttendance());
    }

    @Test
    void sameUserAndTimeOnAnotherDeviceIsADifferentPunch() {
        assertEquals(InsertOutcome.INSERTED, store.insertEventIfAbsent(new AttendanceEvent("42", "DEV1", NINE, null)));
        assertEquals(InsertOutcome.INSERTED, store.insertEventIfAbsent(new AttendanceEvent("42", "DEV2", NINE, null)));
        assertEquals(2L, store.countAttendance());
    }

    @Test
    void unknownUserGetsPlaceholderRow() throws SQLException {
        store.insertEventIfAbsent(new AttendanceEvent("77", "DEV1", NINE, null));
        store.insertEventIfAbsent(new AttendanceEvent("77", "DEV1", NINE.plusSeconds(60), null));

        assertEquals(Optional.empty(), username("77"));
        assertEquals(1L, count("SELECT COUNT(*) FROM users WHERE user_id = '77'"));
        assertEquals(0L, count("SELECT COUNT(*) FROM attendance a LEFT JOIN users u ON a.user_id = u.user_id"
            + " WHERE u.user_id IS NULL"));
    }

    @Test
    void upsertRefreshesUserWithoutDroppingKnownName() throws SQLException {
        store.upsertUser(new UserRecord("42", "Ada", NOW));
        store.upsertUser(new UserRecord("42", "Ada Lovelace", NOW.plusSeconds(60)));
        assertEquals(Optional.of("Ada Lovelace"), username("42"));

        store.upsertUser(new UserRecord("42", null, NOW.plusSeconds(120)));
        assertEquals(Optional.of("Ada Lovelace"), username("42"));
        assertEquals(1L, count("SELECT COUNT(*) FROM users"));
    }

    @Test
    void upsertNamesAPlaceholderUser() throws SQLException {
        store.insertEventIfAbsent(new AttendanceEvent("42", "DEV1", NINE, null));
        store.upsertUser(new UserRecord("42", "Ada", NOW));
        assertEquals(Optional.of("Ada"), username("42"));
    }

    @Test
    void timestampsRoundTripAsUtcWholeSeconds() {
        store.insertEventIfAbsent(new AttendanceEvent("42", "DEV1", NINE.plusMillis(900), null));
        store.insertEventIfAbsent(new AttendanceEvent("42", "DEV1", NINE.plusSeconds(300), null));
        store.insertEventIfAbsent(new AttendanceEvent("43", "DEV2", NINE.plusSeconds(900), null));

        assertEquals(Optional.of(NINE.plusSeconds(300)), store.latestEventTime("DEV1"));
        assertEquals(Optional.empty(), store.latestEventTime("DEV3"));
        assertTrue(store.hasDeviceRecords("DEV2"));
        assertFalse(store.hasDeviceRecords("DEV3"));
        assertEquals(InsertOutcome.ALREADY_EXISTS, store.insertEventIfAbsent(new AttendanceEvent("42", "DEV1", NINE, null)));
    }

    @Test
    void concurrentInsertsOfSameKeyStoreOneRow() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AttendanceEvent event = new AttendanceEvent("42", "DEV1", NINE, null);
        try {
            List<Future<InsertOutcome>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<InsertOutcome> task = () -> {
                    start.await();
                    return store.insertEventIfAbsent(event);
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int inserted = 0;
            for (Future<InsertOutcome> result : results) {
                if (result.get(30, TimeUnit.SECONDS) == InsertOutcome.INSERTED) {
                    inserted++;
                }
            }
            assertEquals(1, inserted);
            assertEquals(1L, store.countAttendance());
        } finally {
            pool.shutdownNow();
        }
    }

    Optional<String> username(String userId) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT username FROM users WHERE user_id = ?")) {
            statement.setString(1, userId);
            try (ResultSet resultSet = statement.executeQuery()) {
                assertTrue(resultSet.next(), "user " + userId + " missing");
                return Optional.ofNullable(resultSet.getString(1));
            }
        }
    }

    long count(String sql) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }
}
