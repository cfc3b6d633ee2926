package com.vrfradar.query;

import com.vrfradar.domain.RandomnessRequest;

import java.time.Instant;

/**
 * Snapshot handed to callers. {@code data} may be stale while {@code loading} is true or {@code error} is set.
 */
public record RequestQueryResult(
        QueryKey key,
        PageResult<RandomnessRequest> data,
        RequestStats stats,
        boolean loading,
        Throwable error,
        BlockWindowInfo window,
        Instant fetchedAt,
        long generation
) {

    public static RequestQueryResult of(QueryState state) {
        QueryParams params = state.key().params();
        PageResult<RandomnessRequest> data = state.page() != null
                ? state.page()
                : PageResult.empty(params.page(), params.pageSize());
        BlockWindowInfo window = state.window() != null ? BlockWindowInfo.of(state.anchorHeight(), state.window()) : null;
        return new RequestQueryResult(state.key(), data, state.stats() != null ? state.stats() : RequestStats.EMPTY,
                state.isFetching(), state.error(), window, state.fetchedAt(), state.committedGeneration());
    }

    public boolean hasError() {
        return error != null;
    }
}
