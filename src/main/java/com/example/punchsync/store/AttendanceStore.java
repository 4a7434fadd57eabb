package com.example.punchsync.store;

import com.example.punchsync.model.AttendanceEvent;
import com.example.punchsync.model.InsertOutcome;
import com.example.punchsync.model.UserRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence gateway shared by all device workers. Implementations must be safe for
 * concurrent use without external locking.
 */
public interface AttendanceStore {

    /**
     * Inserts the user, or refreshes its name and last-seen time if it already exists.
     * A {@code null} display name never overwrites a stored one.
     */
    void upsertUser(UserRecord user);

    /**
     * Stores the punch unless one with the same natural key is already stored. The user it
     * references is created first if it is unknown.
     */
    InsertOutcome insertEventIfAbsent(AttendanceEvent event);

    long countAttendance();

    Optional<Instant> latestEventTime(String deviceSerial);

    boolean hasDeviceRecords(String deviceSerial);
}
