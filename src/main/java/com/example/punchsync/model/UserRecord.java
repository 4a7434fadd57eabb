package com.example.punchsync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A user known to a terminal. Upserted by the store, never deleted.
 */
public final class UserRecord {
    private final String userId;
    private final String displayName;
    private final Instant lastSeenAt;

    public UserRecord(String userId, String displayName, Instant lastSeenAt) {
        Objects.requireNonNull(userId, "userId");
        if (userId.trim().isEmpty()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        this.userId = userId.trim();
        this.displayName = displayName == null ? null : displayName.trim();
        this.lastSeenAt = Objects.requireNonNull(lastSeenAt, "lastSeenAt");
    }

    /**
     * Minimal record for a user referenced by a punch but never listed by its device.
     */
    public static UserRecord placeholder(String userId, Instant seenAt) {
        return new UserRecord(userId, null, seenAt);
    }

    public String getUserId() {
        return userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserRecord)) {
            return false;
        }
        UserRecord that = (UserRecord) o;
        return userId.equals(that.userId)
            && Objects.equals(displayName, that.displayName)
            && lastSeenAt.equals(that.lastSeenAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, displayName, lastSeenAt);
    }

    @Override
    public String toString() {
        return "UserRecord{" +
            "userId='" + userId + '\'' +
            ", displayName='" + displayName + '\'' +
            ", lastSeenAt=" + lastSeenAt +
            '}';
    }
}
