package com.example.punchsync.config;

import com.example.punchsync.store.SqlDialect;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the attendance database.
 */
public class DatabaseConfig {
    private String url;
    private String username;
    private String password;
    private String dialect = "postgresql";
    private int maximumPoolSize = 10;
    private Duration statementTimeout = Duration.ofSeconds(10);
    private boolean initializeSchema = true;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
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

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public int getMaximumPoolSize() {
        return maximumPoolSize;
    }

    public void setMaximumPoolSize(int maximumPoolSize) {
        this.maximumPoolSize = maximumPoolSize;
    }

    public Duration getStatementTimeout() {
        return statementTimeout;
    }

    public void setStatementTimeout(Duration statementTimeout) {
        this.statementTimeout = statementTimeout;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public void applyDefaults() {
        if (dialect == null || dialect.trim().isEmpty()) {
            dialect = "postgresql";
        }
        if (maximumPoolSize <= 0) {
            maximumPoolSize = 10;
        }
        if (statementTimeout == null || statementTimeout.isNegative() || statementTimeout.isZero()) {
            statementTimeout = Duration.ofSeconds(10);
        }
    }

    public void validate() {
        if (url == null || url.trim().isEmpty()) {
            throw new ConfigException("database.url is required");
        }
        resolveDialect();
    }

    public SqlDialect resolveDialect() {
        try {
            return SqlDialect.fromName(dialect);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("database.dialect is not supported: " + dialect, ex);
        }
    }

    @Override
    public String toString() {
        return "DatabaseConfig{" +
            "url='" + url + '\'' +
            ", username='" + username + '\'' +
            ", dialect='" + dialect + '\'' +
            ", maximumPoolSize=" + maximumPoolSize +
            ", statementTimeout=" + statementTimeout +
            ", initializeSchema=" + initializeSchema +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatabaseConfig)) {
            return false;
        }
        DatabaseConfig that = (DatabaseConfig) o;
        return maximumPoolSize == that.maximumPoolSize
            && initializeSchema == that.initializeSchema
            && Objects.equals(url, that.url)
            && Objects.equals(username, that.username)
            && Objects.equals(password, that.password)
            && Objects.equals(dialect, that.dialect)
            && Objects.equals(statementTimeout, that.statementTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, username, password, dialect, maximumPoolSize, statementTimeout, initializeSchema);
    }
}
