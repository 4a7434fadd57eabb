package com.example.punchsync.store;

import com.example.punchsync.model.AttendanceEvent;
import com.example.punchsync.model.InsertOutcome;
import com.example.punchsync.model.UserRecord;
import com.example.punchsync.util.DateTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AttendanceStore} over JDBC.
 * <p>
 * Every call borrows its own pooled connection and runs in autocommit, so workers never
 * share a transaction. Duplicate detection is left to the unique constraint on
 * (user_id, timestamp, device_serial): the insert is attempted and a conflict is reported as
 * {@link InsertOutcome#ALREADY_EXISTS}. There is no read-before-write.
 */
public class JdbcAttendanceStore implements AttendanceStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcAttendanceStore.class);
    private static final int MAX_ATTEMPTS = 3;

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final int queryTimeoutSeconds;
    private final Clock clock;

    public JdbcAttendanceStore(DataSource dataSource, SqlDialect dialect, Duration statementTimeout) {
        this(dataSource, dialect, statementTimeout, Clock.systemUTC());
    }

    public JdbcAttendanceStore(DataSource dataSource, SqlDialect dialect, Duration statementTimeout, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.queryTimeoutSeconds = (int) Math.max(1L, (statementTimeout.toMillis() + 999L) / 1000L);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void upsertUser(UserRecord user) {
        Objects.requireNonNull(user, "user");
        try (Connection connection = dataSource.getConnection()) {
            if (dialect.hasNativeConflictHandling()) {
                try (PreparedStatement statement = prepare(connection, dialect.upsertUserSql())) {
                    bindUser(statement, user);
                    statement.executeUpdate();
                }
                return;
            }
            if (updateUser(connection, user) > 0) {
                return;
            }
            try (PreparedStatement statement = prepare(connection, dialect.insertUserIfAbsentSql())) {
                bindUser(statement, user);
                statement.executeUpdate();
            } catch (SQLException ex) {
                if (!SqlDialect.isUniqueViolation(ex)) {
                    throw ex;
                }
                // another worker inserted the same user in between
                updateUser(connection, user);
            }
        } catch (SQLException ex) {
            throw new StoreException("Failed to upsert user " + user.getUserId(), ex);
        }
    }

    @Override
    public InsertOutcome insertEventIfAbsent(AttendanceEvent event) {
        Objects.requireNonNull(event, "event");
        for (int attempt = 1; ; attempt++) {
            try (Connection connection = dataSource.getConnection()) {
                ensureUser(connection, UserRecord.placeholder(event.getUserId(), clock.instant()));
                return insertEvent(connection, event);
            } catch (SQLException ex) {
                if (attempt < MAX_ATTEMPTS && SqlDialect.isTransientConflict(ex)) {
                    LOGGER.debug("Transient conflict storing {}, retrying: {}", event, ex.getMessage());
                    continue;
                }
                throw new StoreException("Failed to store punch " + event, ex);
            }
        }
    }

    @Override
    public long countAttendance() {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = prepare(connection, "SELECT COUNT(*) FROM attendance");
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        } catch (SQLException ex) {
            throw new StoreException("Failed to count punches", ex);
        }
    }

    @Override
    public Optional<Instant> latestEventTime(String deviceSerial) {
        Objects.requireNonNull(deviceSerial, "deviceSerial");
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = prepare(connection, "SELECT MAX(timestamp) FROM attendance WHERE device_serial = ?")) {
            statement.setString(1, deviceSerial);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                Timestamp latest = resultSet.getTimestamp(1);
                return latest == null ? Optional.empty() : Optional.of(fromTimestamp(latest));
            }
        } catch (SQLException ex) {
            throw new StoreException("Failed to read latest punch for " + deviceSerial, ex);
        }
    }

    @Override
    public boolean hasDeviceRecords(String deviceSerial) {
        Objects.requireNonNull(deviceSerial, "deviceSerial");
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = prepare(connection, "SELECT 1 FROM attendance WHERE device_serial = ?")) {
            statement.setString(1, deviceSerial);
            statement.setMaxRows(1);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        } catch (SQLException ex) {
            throw new StoreException("Failed to look up punches for " + deviceSerial, ex);
        }
    }

    private InsertOutcome insertEvent(Connection connection, AttendanceEvent event) throws SQLException {
        try (PreparedStatement statement = prepare(connection, dialect.insertEventSql())) {
            statement.setString(1, event.getUserId());
            statement.setTimestamp(2, toTimestamp(event.getEventTime()));
            statement.setString(3, event.getDeviceSerial());
            if (event.getRawSequence().isPresent()) {
                statement.setLong(4, event.getRawSequence().getAsLong());
            } else {
                statement.setNull(4, Types.BIGINT);
            }
            return statement.executeUpdate() > 0 ? InsertOutcome.INSERTED : InsertOutcome.ALREADY_EXISTS;
        } catch (SQLException ex) {
            if (SqlDialect.isUniqueViolation(ex)) {
                return InsertOutcome.ALREADY_EXISTS;
            }
            throw ex;
        }
    }

    private void ensureUser(Connection connection, UserRecord user) throws SQLException {
        try (PreparedStatement statement = prepare(connection, dialect.insertUserIfAbsentSql())) {
            bindUser(statement, user);
            if (statement.executeUpdate() > 0) {
                LOGGER.info("Created placeholder user {} for an unlisted punch", user.getUserId());
            }
        } catch (SQLException ex) {
            if (!SqlDialect.isUniqueViolation(ex)) {
                throw ex;
            }
        }
    }

    private int updateUser(Connection connection, UserRecord user) throws SQLException {
        try (PreparedStatement statement = prepare(connection, dialect.updateUserSql())) {
            statement.setString(1, user.getDisplayName());
            statement.setTimestamp(2, toTimestamp(user.getLastSeenAt()));
            statement.setString(3, user.getUserId());
            return statement.executeUpdate();
        }
    }

    private void bindUser(PreparedStatement statement, UserRecord user) throws SQLException {
        statement.setString(1, user.getUserId());
        statement.setString(2, user.getDisplayName());
        statement.setTimestamp(3, toTimestamp(user.getLastSeenAt()));
    }

    private PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        statement.setQueryTimeout(queryTimeoutSeconds);
        return statement;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.valueOf(DateTimes.toUtcLocal(DateTimes.canonical(instant)));
    }

    private static Instant fromTimestamp(Timestamp timestamp) {
        return DateTimes.fromUtcLocal(timestamp.toLocalDateTime());
    }
}
