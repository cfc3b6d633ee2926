package com.vrfradar.ingestion.adapter;

import com.vrfradar.domain.BlockRef;
import com.vrfradar.domain.EventKind;
import com.vrfradar.domain.WindowCursor;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Typed access to the {@link LedgerReader}: every call is paced by the RPC rate limiter, bounded by a timeout
 * and fails only with {@link LedgerUnavailableException}. Nothing is retried here; retry policy belongs to the caller.
 */
@Slf4j
public class LedgerAdapter {

    private final LedgerReader reader;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    public LedgerAdapter(LedgerReader reader, RateLimiter rateLimiter, Duration timeout) {
        this.reader = reader;
        this.rateLimiter = rateLimiter;
        this.timeout = timeout;
    }

    public Mono<Long> currentHeight() {
        return guarded("eth_blockNumber", reader::currentBlockHeight);
    }

    public Mono<List<RawLog>> fetchLogs(EventKind kind, WindowCursor window) {
        return guarded(kind.eventName() + " logs [" + window.fromBlock() + "-" + window.toBlock() + "]",
                () -> reader.getLogs(kind.signature(), window.fromBlock(), window.toBlock()));
    }

    public Mono<List<RawLog>> fetchLogs(EventKind kind, long fromBlock, long toBlock) {
        return fetchLogs(kind, new WindowCursor(fromBlock, toBlock, 0, false));
    }

    public Mono<BlockRef> fetchBlock(long number) {
        return guarded("block " + number, () -> reader.getBlock(number));
    }

    public Mono<Map<Long, BlockRef>> fetchBlocks(Collection<Long> numbers) {
        if (numbers.isEmpty()) {
            return Mono.just(Map.of());
        }
        return guarded(numbers.size() + " block header(s)", () -> reader.getBlocks(numbers));
    }

    /**
     * Headers for the logs that arrived without a block timestamp, one batched lookup.
     */
    public Mono<Map<Long, BlockRef>> fetchMissingBlocks(List<RawLog> logs) {
        Set<Long> missing = new TreeSet<>();
        for (RawLog raw : logs) {
            if (raw.blockTimestamp() == null) {
                missing.add(raw.blockNumber());
            }
        }
        return fetchBlocks(missing);
    }

    private <T> Mono<T> guarded(String what, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
                    long waitNanos = rateLimiter.reservePermission();
                    if (waitNanos < 0) {
                        return Mono.error(new LedgerUnavailableException("RPC budget exhausted for " + what));
                    }
                    Mono<T> invocation = Mono.defer(call);
                    return waitNanos > 0 ? Mono.delay(Duration.ofNanos(waitNanos)).then(invocation) : invocation;
                })
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof LedgerUnavailableException), e -> toUnavailable(what, e))
                .doOnError(e -> log.warn("Ledger call failed: {}: {}", what, e.getMessage()));
    }

    private LedgerUnavailableException toUnavailable(String what, Throwable e) {
        if (e instanceof TimeoutException) {
            return new LedgerUnavailableException(what + " timed out after " + timeout.toMillis() + " ms", e);
        }
        return new LedgerUnavailableException(what + " failed: " + e.getMessage(), e);
    }
}
