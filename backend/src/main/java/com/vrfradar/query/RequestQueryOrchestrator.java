package com.vrfradar.query;

import com.github.benmanes.caffeine.cache.Cache;
import com.vrfradar.aggregation.AggregateMerger;
import com.vrfradar.domain.DomainEvent;
import com.vrfradar.domain.EventKind;
import com.vrfradar.domain.RandomnessRequest;
import com.vrfradar.domain.RandomnessRequestedEvent;
import com.vrfradar.domain.WindowCursor;
import com.vrfradar.ingestion.adapter.LedgerAdapter;
import com.vrfradar.ingestion.adapter.LedgerUnavailableException;
import com.vrfradar.ingestion.adapter.RawLog;
import com.vrfradar.ingestion.config.LedgerProperties;
import com.vrfradar.ingestion.decoder.EventDecoder;
import com.vrfradar.ingestion.window.WindowSelector;
import com.vrfradar.live.LiveUpdateSubscriber;
import com.vrfradar.live.Unsubscribe;
import com.vrfradar.query.config.QueryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs the request pipeline (window, three concurrent log fetches, block timestamps, decode, merge, view) per
 * {@link QueryKey} and owns the cached {@link QueryState} of every key.
 * <p>
 * Each execution takes a new generation from a global counter and records it as the key's in-flight
 * generation. A result commits only while the key still expects that generation; switching the active key
 * abandons the previous key's in-flight generation. Cache entries are replaced wholesale through
 * {@code compute}. A failed execution keeps the last good data and sets the error.
 * <p>
 * The block-height anchor is read from the ledger on the first execution and whenever the latest window
 * (page 0) is fetched; older window pages reuse it, so paging back does not shift the windows.
 */
@Slf4j
@Service
public class RequestQueryOrchestrator {

    private final LedgerAdapter ledger;
    private final WindowSelector windowSelector;
    private final EventDecoder decoder;
    private final AggregateMerger merger;
    private final RequestView view;
    private final LiveUpdateSubscriber liveUpdates;
    private final Cache<QueryKey, QueryState> cache;
    private final Clock clock;
    private final long windowBlocks;
    private final Duration staleTime;

    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong anchorHeight = new AtomicLong(-1);
    private final AtomicReference<QueryKey> activeKey = new AtomicReference<>();
    private final Map<QueryKey, InFlight> inFlight = new ConcurrentHashMap<>();

    public RequestQueryOrchestrator(LedgerAdapter ledger,
                                    WindowSelector windowSelector,
                                    EventDecoder decoder,
                                    AggregateMerger merger,
                                    RequestView view,
                                    LiveUpdateSubscriber liveUpdates,
                                    Cache<QueryKey, QueryState> cache,
                                    Clock clock,
                                    LedgerProperties ledgerProperties,
                                    QueryProperties queryProperties) {
        this.ledger = ledger;
        this.windowSelector = windowSelector;
        this.decoder = decoder;
        this.merger = merger;
        this.view = view;
        this.liveUpdates = liveUpdates;
        this.cache = cache;
        this.clock = clock;
        this.windowBlocks = ledgerProperties.getWindowBlocks();
        this.staleTime = Duration.ofMillis(queryProperties.getStaleTimeMs());
    }

    /**
     * Makes the key active and returns its settled state: straight from cache when fresh or when it failed and
     * has not been invalidated since, joined to the running execution when one is in flight, otherwise from a
     * new execution. Failed keys are retried by {@link #refetch()}, {@link #invalidate(QueryKey)} and the
     * stale refresh, never by a plain read.
     */
    public Mono<RequestQueryResult> query(QueryParams params, int windowPage) {
        QueryKey key = new QueryKey(windowPage, params);
        activate(key);
        QueryState state = cache.getIfPresent(key);
        if (state != null && (state.isFresh(clock.instant(), staleTime) || state.isSettledFailure())) {
            return Mono.just(RequestQueryResult.of(state));
        }
        if (state != null && state.isFetching()) {
            InFlight running = inFlight.get(key);
            if (running != null && running.generation() == state.inFlightGeneration()) {
                return running.result();
            }
        }
        return execute(key);
    }

    /** Snapshot of the active key, including {@code loading} and the last error. Empty before the first query. */
    public Optional<RequestQueryResult> current() {
        QueryKey key = activeKey.get();
        if (key == null) {
            return Optional.empty();
        }
        QueryState state = cache.getIfPresent(key);
        return Optional.of(RequestQueryResult.of(state != null ? state : QueryState.idle(key)));
    }

    /** Re-runs the active key regardless of freshness; fails with {@link NoActiveQueryException} before any query. */
    public Mono<RequestQueryResult> refetch() {
        QueryKey key = activeKey.get();
        if (key == null) {
            return Mono.error(new NoActiveQueryException());
        }
        return execute(key);
    }

    /**
     * The active key is re-fetched at once; any other key is only marked stale and re-fetched on its next read.
     */
    public void invalidate(QueryKey key) {
        if (key.equals(activeKey.get())) {
            execute(key);
            return;
        }
        cache.asMap().computeIfPresent(key, (k, state) -> state.stale());
    }

    /** Invalidates every cached key of window page 0. */
    public void invalidateLatestWindow() {
        for (QueryKey key : List.copyOf(cache.asMap().keySet())) {
            if (key.isLatestWindow()) {
                invalidate(key);
            }
        }
        QueryKey active = activeKey.get();
        if (active != null && active.isLatestWindow() && !cache.asMap().containsKey(active)) {
            execute(active);
        }
    }

    /**
     * @return true when a new execution was started for the active key
     */
    public boolean refreshActiveIfStale() {
        QueryKey key = activeKey.get();
        if (key == null) {
            return false;
        }
        QueryState state = cache.getIfPresent(key);
        if (state != null && (state.isFetching() || state.isFresh(clock.instant(), staleTime))) {
            return false;
        }
        log.debug("Refreshing stale active query {}", key);
        execute(key);
        return true;
    }

    public Optional<BlockWindowInfo> blockWindowInfo() {
        return current().map(RequestQueryResult::window);
    }

    /** Looks a request up in the active window, ignoring filters and result-set paging. */
    public Optional<RandomnessRequest> findRequest(BigInteger id) {
        QueryKey key = activeKey.get();
        QueryState state = key != null ? cache.getIfPresent(key) : null;
        return state == null ? Optional.empty() : Optional.ofNullable(state.aggregates().get(id));
    }

    /**
     * Live updates: every batch of new requests at the tip invalidates the latest window before the callback runs.
     */
    public Unsubscribe subscribe(Consumer<List<RandomnessRequestedEvent>> onNewRequests) {
        return liveUpdates.subscribe(this::invalidateLatestWindow, onNewRequests);
    }

    private void activate(QueryKey key) {
        QueryKey previous = activeKey.getAndSet(key);
        if (previous != null && !previous.equals(key)) {
            cache.asMap().computeIfPresent(previous, (k, state) -> {
                if (!state.isFetching()) {
                    return state;
                }
                log.debug("Abandoning generation {} of {}", state.inFlightGeneration(), k);
                return state.abandoned();
            });
        }
    }

    private Mono<RequestQueryResult> execute(QueryKey key) {
        long generation = generations.incrementAndGet();
        cache.asMap().compute(key, (k, current) -> (current != null ? current : QueryState.idle(k)).fetching(generation));
        log.debug("Starting generation {} for {}", generation, key);

        Mono<RequestQueryResult> result = resolveAnchor(key)
                .flatMap(anchor -> load(key, anchor))
                .map(loaded -> commit(key, generation, loaded))
                .onErrorResume(e -> Mono.just(fail(key, generation, e)))
                .doFinally(signal -> inFlight.computeIfPresent(key, (k, f) -> f.generation() == generation ? null : f))
                .cache();
        inFlight.put(key, new InFlight(generation, result));
        result.subscribe();
        return result;
    }

    private Mono<Long> resolveAnchor(QueryKey key) {
        long anchor = anchorHeight.get();
        if (!key.isLatestWindow() && anchor >= 0) {
            return Mono.just(anchor);
        }
        return ledger.currentHeight().doOnNext(this::advanceAnchor);
    }

    private void advanceAnchor(long height) {
        long previous = anchorHeight.getAndSet(height);
        if (previous < 0 || previous == height) {
            return;
        }
        log.debug("Anchor height moved {} -> {}", previous, height);
        for (QueryKey key : List.copyOf(cache.asMap().keySet())) {
            if (!key.isLatestWindow()) {
                cache.asMap().computeIfPresent(key, (k, state) -> state.stale());
            }
        }
    }

    private Mono<Loaded> load(QueryKey key, long anchor) {
        WindowCursor window = windowSelector.select(anchor, key.windowPage(), windowBlocks);
        return Mono.zip(
                        ledger.fetchLogs(EventKind.REQUESTED, window),
                        ledger.fetchLogs(EventKind.FULFILLED, window),
                        ledger.fetchLogs(EventKind.CALLBACK_FAILED, window))
                .flatMap(logs -> {
                    List<RawLog> all = new ArrayList<>(logs.getT1());
                    all.addAll(logs.getT2());
                    all.addAll(logs.getT3());
                    return ledger.fetchMissingBlocks(all).map(blocks -> decoder.decodeAll(all, blocks));
                })
                .map(events -> new Loaded(anchor, window, events));
    }

    private RequestQueryResult commit(QueryKey key, long generation, Loaded loaded) {
        Map<BigInteger, RandomnessRequest> aggregates = merger.merge(Map.of(), loaded.events());
        Collection<RandomnessRequest> all = aggregates.values();
        PageResult<RandomnessRequest> page = view.view(all, key.params());
        RequestStats stats = view.stats(all, key.params().filters());
        Instant now = clock.instant();
        QueryState settled = cache.asMap().compute(key, (k, current) -> {
            if (current == null || current.inFlightGeneration() != generation) {
                return current;
            }
            return current.ready(generation, loaded.anchor(), loaded.window(), aggregates, page, stats, now);
        });
        if (settled == null || settled.committedGeneration() != generation) {
            log.debug("Discarding result of stale generation {} for {}", generation, key);
            return RequestQueryResult.of(settled != null ? settled : QueryState.idle(key));
        }
        log.debug("Generation {} for {} committed: {} request(s) in blocks [{}-{}]",
                generation, key, aggregates.size(), loaded.window().fromBlock(), loaded.window().toBlock());
        return RequestQueryResult.of(settled);
    }

    private RequestQueryResult fail(QueryKey key, long generation, Throwable error) {
        QueryState settled = cache.asMap().compute(key, (k, current) -> {
            if (current == null || current.inFlightGeneration() != generation) {
                return current;
            }
            return current.failed(generation, error);
        });
        if (settled == null || settled.error() != error) {
            log.debug("Discarding failure of stale generation {} for {}: {}", generation, key, error.getMessage());
            return RequestQueryResult.of(settled != null ? settled : QueryState.idle(key));
        }
        if (error instanceof LedgerUnavailableException) {
            log.warn("Query {} failed (generation {}), keeping previous data: {}", key, generation, error.getMessage());
        } else {
            log.error("Query {} failed unexpectedly (generation {})", key, generation, error);
        }
        return RequestQueryResult.of(settled);
    }

    private record InFlight(long generation, Mono<RequestQueryResult> result) {
    }

    private record Loaded(long anchor, WindowCursor window, List<DomainEvent> events) {
    }
}
