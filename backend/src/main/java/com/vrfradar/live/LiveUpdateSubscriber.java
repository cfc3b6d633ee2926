package com.vrfradar.live;

import com.vrfradar.domain.DomainEvent;
import com.vrfradar.domain.EventKind;
import com.vrfradar.domain.RandomnessRequestedEvent;
import com.vrfradar.ingestion.adapter.LedgerAdapter;
import com.vrfradar.ingestion.adapter.RawLog;
import com.vrfradar.ingestion.decoder.EventDecoder;
import com.vrfradar.live.config.LiveUpdateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Polls the chain tip for new {@code RandomnessRequested} events. New events are never merged here: the
 * subscriber runs the invalidation hook (which re-runs the full pipeline for the latest window) and then the
 * callback. Ledger errors are logged and the same block range is retried on the next tick.
 */
@Slf4j
@Component
public class LiveUpdateSubscriber {

    private final LedgerAdapter ledger;
    private final EventDecoder decoder;
    private final TaskScheduler scheduler;
    private final LiveUpdateProperties properties;

    public LiveUpdateSubscriber(LedgerAdapter ledger,
                                EventDecoder decoder,
                                TaskScheduler scheduler,
                                LiveUpdateProperties properties) {
        this.ledger = ledger;
        this.decoder = decoder;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    /**
     * Starts polling at the tip observed on the first tick, that block included.
     *
     * @param invalidation run before every delivery, inside the same cancellation guard
     * @param onNewRequests receives the newly observed requests in chain order
     */
    public Unsubscribe subscribe(Runnable invalidation, Consumer<List<RandomnessRequestedEvent>> onNewRequests) {
        Subscription subscription = new Subscription(invalidation, onNewRequests);
        subscription.future = scheduler.scheduleWithFixedDelay(subscription,
                Duration.ofMillis(properties.getPollIntervalMs()));
        log.info("Live updates subscribed, polling every {} ms", properties.getPollIntervalMs());
        return subscription;
    }

    private static final long NOT_STARTED = Long.MIN_VALUE;

    private final class Subscription implements Runnable, Unsubscribe {

        private final Runnable invalidation;
        private final Consumer<List<RandomnessRequestedEvent>> callback;
        private final AtomicBoolean closed = new AtomicBoolean();
        private final AtomicBoolean polling = new AtomicBoolean();
        private final Object deliveryLock = new Object();
        private volatile long lastSeen = NOT_STARTED;
        private volatile ScheduledFuture<?> future;

        private Subscription(Runnable invalidation, Consumer<List<RandomnessRequestedEvent>> callback) {
            this.invalidation = invalidation;
            this.callback = callback;
        }

        @Override
        public void run() {
            if (closed.get() || !polling.compareAndSet(false, true)) {
                return;
            }
            poll()
                    .doFinally(signal -> polling.set(false))
                    .subscribe(this::deliver,
                            e -> log.warn("Live update poll failed after block {}, retrying next tick: {}",
                                    lastSeen, e.getMessage()));
        }

        @Override
        public void unsubscribe() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
            // wait out a delivery already in progress
            synchronized (deliveryLock) {
                log.info("Live updates unsubscribed at block {}", lastSeen);
            }
        }

        private Mono<List<RandomnessRequestedEvent>> poll() {
            return ledger.currentHeight().flatMap(tip -> {
                if (lastSeen == NOT_STARTED) {
                    // the tip block itself is scanned
                    lastSeen = tip - 1;
                }
                if (tip <= lastSeen) {
                    return Mono.just(List.<RandomnessRequestedEvent>of());
                }
                long from = Math.max(lastSeen + 1, tip - properties.getMaxBlocksPerPoll() + 1);
                return ledger.fetchLogs(EventKind.REQUESTED, from, tip)
                        .flatMap(this::decode)
                        .doOnNext(events -> lastSeen = tip);
            });
        }

        private Mono<List<RandomnessRequestedEvent>> decode(List<RawLog> logs) {
            if (logs.isEmpty()) {
                return Mono.just(List.of());
            }
            return ledger.fetchMissingBlocks(logs).map(blocks -> decoder.decodeAll(logs, blocks).stream()
                    .filter(RandomnessRequestedEvent.class::isInstance)
                    .map(RandomnessRequestedEvent.class::cast)
                    .sorted(DomainEvent.CHAIN_ORDER)
                    .toList());
        }

        private void deliver(List<RandomnessRequestedEvent> events) {
            if (events.isEmpty()) {
                return;
            }
            synchronized (deliveryLock) {
                if (closed.get()) {
                    log.debug("Dropping {} live event(s) after unsubscribe", events.size());
                    return;
                }
                log.info("Observed {} new randomness request(s) up to block {}", events.size(), lastSeen);
                invalidation.run();
                callback.accept(events);
            }
        }
    }
}
