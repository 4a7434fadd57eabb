package com.example.punchsync.store;

import java.sql.SQLException;
import java.util.Locale;

/**
 * SQL flavours the store can speak. PostgreSQL resolves conflicts in the statement itself;
 * the generic flavour issues plain inserts and treats a unique-constraint violation as the
 * conflict outcome.
 */
public enum SqlDialect {
    POSTGRESQL(true),
    GENERIC(false);

    private static final String EVENT_COLUMNS = "attendance (user_id, timestamp, device_serial, raw_sequence) VALUES (?, ?, ?, ?)";
    private static final String USER_COLUMNS = "users (user_id, username, last_seen_at) VALUES (?, ?, ?)";

    private final boolean nativeConflictHandling;

    SqlDialect(boolean nativeConflictHandling) {
        this.nativeConflictHandling = nativeConflictHandling;
    }

    public static SqlDialect fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("dialect must not be null");
        }
        return SqlDialect.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    public boolean hasNativeConflictHandling() {
        return nativeConflictHandling;
    }

    String insertEventSql() {
        if (nativeConflictHandling) {
            return "INSERT INTO " + EVENT_COLUMNS + " ON CONFLICT (user_id, timestamp, device_serial) DO NOTHING";
        }
        return "INSERT INTO " + EVENT_COLUMNS;
    }

    String insertUserIfAbsentSql() {
        if (nativeConflictHandling) {
            return "INSERT INTO " + USER_COLUMNS + " ON CONFLICT (user_id) DO NOTHING";
        }
        return "INSERT INTO " + USER_COLUMNS;
    }

    /**
     * Single-statement upsert; only available with native conflict handling.
     */
    String upsertUserSql() {
        if (!nativeConflictHandling) {
            throw new UnsupportedOperationException(name() + " has no single-statement upsert");
        }
        return "INSERT INTO " + USER_COLUMNS + " ON CONFLICT (user_id) DO UPDATE SET "
            + "username = COALESCE(EXCLUDED.username, users.username), "
            + "last_seen_at = EXCLUDED.last_seen_at, "
            + "updated_at = CURRENT_TIMESTAMP";
    }

    String updateUserSql() {
        return "UPDATE users SET username = COALESCE(?, username), last_seen_at = ?, updated_at = CURRENT_TIMESTAMP "
            + "WHERE user_id = ?";
    }

    /**
     * Whether {@code ex} reports a duplicate key. Foreign-key and not-null violations share
     * the integrity-constraint SQLState class and are not duplicates.
     */
    static boolean isUniqueViolation(SQLException ex) {
        for (SQLException current = ex; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if ("23505".equals(state)) {
                return true;
            }
            if ("23000".equals(state)) {
                String message = current.getMessage();
                if (message != null) {
                    String lower = message.toLowerCase(Locale.ROOT);
                    if (lower.contains("duplicate") || lower.contains("unique")) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Serialization failures and lock conflicts between concurrent inserts of the same key.
     * Retrying the statement resolves them into a normal insert or a duplicate.
     */
    static boolean isTransientConflict(SQLException ex) {
        for (SQLException current = ex; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if ("40001".equals(state) || "40P01".equals(state) || "90131".equals(state)) {
                return true;
            }
        }
        return false;
    }
}
