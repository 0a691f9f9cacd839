package com.shipyard.orchestrator.statemachine;

import java.util.List;

/**
 * A newest-first page of an append-only log.
 *
 * @param nextCursor pass back to fetch the next (older) page; null when there is none
 */
public record HistoryPage<T>(List<T> items, String nextCursor) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT     = 100;

    public static int clampLimit(Integer requested) {
        if (requested == null || requested <= 0) return DEFAULT_LIMIT;
        return Math.min(requested, MAX_LIMIT);
    }

    /**
     * Decode a cursor into the exclusive upper bound on record ids.
     * A missing cursor means "start from the newest".
     */
    public static long decodeCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) return Long.MAX_VALUE;
        try {
            long id = Long.parseLong(cursor);
            if (id <= 0) throw new IllegalArgumentException("Invalid cursor: " + cursor);
            return id;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
        }
    }

    /** Cursor for the page after one ending at {@code lastId}, or null if the page was short. */
    public static String nextCursor(int pageSize, int limit, Long lastId) {
        return (pageSize == limit && lastId != null) ? String.valueOf(lastId) : null;
    }
}
