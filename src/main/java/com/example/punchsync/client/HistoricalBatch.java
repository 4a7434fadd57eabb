package com.example.punchsync.client;

import com.example.punchsync.model.RawRecord;

import java.util.Collections;
import java.util.List;

/**
 * Result of one historical drain. {@code backlogRemaining} is set when the terminal still
 * reported more records after the driver stopped paging.
 */
public final class HistoricalBatch {
    private final List<RawRecord> records;
    private final boolean backlogRemaining;

    public HistoricalBatch(List<RawRecord> records, boolean backlogRemaining) {
        this.records = Collections.unmodifiableList(records == null ? Collections.emptyList() : List.copyOf(records));
        this.backlogRemaining = backlogRemaining;
    }

    public static HistoricalBatch complete(List<RawRecord> records) {
        return new HistoricalBatch(records, false);
    }

    public List<RawRecord> getRecords() {
        return records;
    }

    public boolean isBacklogRemaining() {
        return backlogRemaining;
    }

    @Override
    public String toString() {
        return "HistoricalBatch{" +
            "records=" + records.size() +
            ", backlogRemaining=" + backlogRemaining +
            '}';
    }
}
