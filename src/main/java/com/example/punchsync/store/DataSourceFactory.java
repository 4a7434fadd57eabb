package com.example.punchsync.store;

import com.example.punchsync.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.Objects;

/**
 * Builds the connection pool shared by every device worker.
 */
public final class DataSourceFactory {
    private static final long MIN_CONNECTION_TIMEOUT_MILLIS = 250L;

    private DataSourceFactory() {
    }

    public static HikariDataSource create(DatabaseConfig config) {
        Objects.requireNonNull(config, "config");
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("punch-sync-db");
        hikari.setJdbcUrl(config.getUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setConnectionTimeout(Math.max(config.getStatementTimeout().toMillis(), MIN_CONNECTION_TIMEOUT_MILLIS));
        hikari.setAutoCommit(true);
        // let workers start and retry while the database is still down
        hikari.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikari);
    }
}
