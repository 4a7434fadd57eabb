package com.example.punchsync.client.isapi;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * Decides which {@code searchResultPosition} the next ISAPI search page should request.
 * Positions are 0-based.
 */
public final class PaginationPlanner {
    static final String STATUS_MORE = "MORE";
    static final String STATUS_OK = "OK";
    static final String STATUS_NO_MATCH = "NO MATCH";

    private PaginationPlanner() {
    }

    public static OptionalInt calculateNext(int currentPosition, int returned, int totalMatches, int pageSize, String status) {
        if (returned <= 0) {
            return OptionalInt.empty();
        }
        int next = Math.max(currentPosition, 0) + returned;
        if (status != null && !status.trim().isEmpty()) {
            String normalised = status.trim().toUpperCase(Locale.ROOT);
            if (STATUS_MORE.equals(normalised)) {
                return OptionalInt.of(next);
            }
            if (STATUS_OK.equals(normalised) || STATUS_NO_MATCH.equals(normalised)) {
                return OptionalInt.empty();
            }
        }
        if (totalMatches > 0 && next >= totalMatches) {
            return OptionalInt.empty();
        }
        if (totalMatches <= 0 && returned < Math.max(pageSize, 1)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(next);
    }
}
