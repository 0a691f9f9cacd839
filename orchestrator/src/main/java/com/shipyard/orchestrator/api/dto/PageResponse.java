package com.shipyard.orchestrator.api.dto;

import com.shipyard.orchestrator.statemachine.HistoryPage;

import java.util.List;
import java.util.function.Function;

/** Cursor page: pass nextCursor back as ?cursor= until it is null. */
public record PageResponse<T>(List<T> items, String nextCursor) {

    public static <S, T> PageResponse<T> from(HistoryPage<S> page, Function<S, T> mapper) {
        return new PageResponse<>(page.items().stream().map(mapper).toList(), page.nextCursor());
    }
}
