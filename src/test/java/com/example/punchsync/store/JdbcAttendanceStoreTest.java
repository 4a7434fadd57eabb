package com.example.punchsync.store;

import com.example.punchsync.config.DatabaseConfig;
import com.example.punchsync.model.AttendanceEvent;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAttendanceStoreTest extends AbstractJdbcAttendanceStoreTest {

    @Override
    DatabaseConfig databaseConfig() {
        DatabaseConfig config = new DatabaseConfig();
        config.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setPassword("");
        config.setDialect("generic");
        return config;
    }

    @Test
    void unreachableDatabaseIsAStoreException() {
        DatabaseConfig config = new DatabaseConfig();
        config.setUrl("jdbc:h2:tcp://127.0.0.1:1/nowhere");
        config.setDialect("generic");
        config.setStatementTimeout(Duration.ofMillis(300));
        config.applyDefaults();
        try (HikariDataSource unreachable = DataSourceFactory.create(config)) {
            JdbcAttendanceStore broken = new JdbcAttendanceStore(unreachable, SqlDialect.GENERIC, config.getStatementTimeout());
            assertThrows(StoreException.class,
                () -> broken.insertEventIfAbsent(new AttendanceEvent("42", "DEV1", NINE, null)));
        }
    }
}
