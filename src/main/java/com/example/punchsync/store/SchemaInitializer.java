package com.example.punchsync.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * Creates the {@code users} and {@code attendance} tables and their indexes if they do not
 * exist yet. Safe to run on every start.
 */
public class SchemaInitializer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaInitializer.class);

    private static final List<String> STATEMENTS = List.of(
        "CREATE TABLE IF NOT EXISTS users ("
            + " user_id VARCHAR(50) PRIMARY KEY,"
            + " username VARCHAR(100),"
            + " last_seen_at TIMESTAMP,"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP"
            + ")",
        "CREATE TABLE IF NOT EXISTS attendance ("
            + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " user_id VARCHAR(50) NOT NULL REFERENCES users (user_id),"
            + " timestamp TIMESTAMP NOT NULL,"
            + " device_serial VARCHAR(150) NOT NULL,"
            + " raw_sequence BIGINT,"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " CONSTRAINT uq_attendance_natural_key UNIQUE (user_id, timestamp, device_serial)"
            + ")",
        "CREATE INDEX IF NOT EXISTS idx_attendance_user_id ON attendance (user_id)",
        "CREATE INDEX IF NOT EXISTS idx_attendance_timestamp ON attendance (timestamp)"
    );

    private final DataSource dataSource;

    public SchemaInitializer(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    public void ensureTables() {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                for (String sql : STATEMENTS) {
                    statement.execute(sql);
                }
                connection.commit();
            } catch (SQLException ex) {
                rollbackQuietly(connection);
                throw ex;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
            LOGGER.info("Database tables verified/created");
        } catch (SQLException ex) {
            throw new StoreException("Failed to create attendance schema", ex);
        }
    }

    private void rollbackQuietly(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            LOGGER.warn("Failed to rollback schema changes", rollbackEx);
        }
    }
}
