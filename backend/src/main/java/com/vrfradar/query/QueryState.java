package com.vrfradar.query;

import com.vrfradar.domain.RandomnessRequest;
import com.vrfradar.domain.WindowCursor;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable per-key query state. Every transition returns a new instance that replaces the cache entry
 * wholesale. A FAILED state keeps the last successful window, aggregates and page, and is served as is
 * until something invalidates it.
 *
 * @param inFlightGeneration generation allowed to commit next, 0 when nothing is in flight
 * @param committedGeneration generation that produced the current data, 0 when none
 * @param invalidated set by {@link #stale()} and {@link #abandoned()}; a FAILED state is re-run on read only then
 */
public record QueryState(
        QueryKey key,
        QueryStatus status,
        long inFlightGeneration,
        long committedGeneration,
        long anchorHeight,
        WindowCursor window,
        Map<BigInteger, RandomnessRequest> aggregates,
        PageResult<RandomnessRequest> page,
        RequestStats stats,
        Throwable error,
        Instant fetchedAt,
        boolean invalidated
) {

    public static QueryState idle(QueryKey key) {
        return new QueryState(key, QueryStatus.IDLE, 0, 0, -1, null, Map.of(), null, null, null, null, false);
    }

    public QueryState fetching(long generation) {
        return new QueryState(key, QueryStatus.FETCHING, generation, committedGeneration, anchorHeight, window,
                aggregates, page, stats, error, fetchedAt, false);
    }

    public QueryState ready(long generation, long anchor, WindowCursor newWindow,
                            Map<BigInteger, RandomnessRequest> newAggregates, PageResult<RandomnessRequest> newPage,
                            RequestStats newStats, Instant now) {
        return new QueryState(key, QueryStatus.READY, 0, generation, anchor, newWindow, newAggregates, newPage,
                newStats, null, now, false);
    }

    public QueryState failed(long generation, Throwable cause) {
        return new QueryState(key, QueryStatus.FAILED, 0, committedGeneration, anchorHeight, window, aggregates,
                page, stats, cause, fetchedAt, false);
    }

    /** Drops the in-flight generation; its result will be discarded on arrival. */
    public QueryState abandoned() {
        QueryStatus settled = error != null ? QueryStatus.FAILED : page != null ? QueryStatus.READY : QueryStatus.IDLE;
        return new QueryState(key, settled, 0, committedGeneration, anchorHeight, window, aggregates, page, stats,
                error, fetchedAt, true);
    }

    /** Keeps the data but forces the next read to refetch. */
    public QueryState stale() {
        return new QueryState(key, status, inFlightGeneration, committedGeneration, anchorHeight, window,
                aggregates, page, stats, error, null, true);
    }

    public boolean isFetching() {
        return status == QueryStatus.FETCHING;
    }

    /** A failure nobody has invalidated yet; reads get it from cache instead of hitting the ledger again. */
    public boolean isSettledFailure() {
        return status == QueryStatus.FAILED && !invalidated;
    }

    public boolean isFresh(Instant now, Duration staleTime) {
        return status == QueryStatus.READY && fetchedAt != null && fetchedAt.plus(staleTime).isAfter(now);
    }
}
