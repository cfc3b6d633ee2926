package com.vrfradar.aggregation;

import com.vrfradar.aggregation.config.AggregationProperties;
import com.vrfradar.domain.DomainEvent;
import com.vrfradar.domain.EventKey;
import com.vrfradar.domain.RandomnessCallbackFailedEvent;
import com.vrfradar.domain.RandomnessFulfilledEvent;
import com.vrfradar.domain.RandomnessRequest;
import com.vrfradar.domain.RandomnessRequestedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds coordinator events into request aggregates keyed by request id.
 * <ul>
 *   <li>events are de-duplicated by (txHash, logIndex), then applied per request id in (blockNumber, logIndex) order</li>
 *   <li>{@code Requested} creates a PENDING aggregate only when none exists for the id</li>
 *   <li>{@code Fulfilled} / {@code CallbackFailed} move a PENDING aggregate to FULFILLED / FAILED</li>
 *   <li>events for an unknown id (orphans) are dropped; events for a settled aggregate are no-ops</li>
 * </ul>
 * The input map is never modified.
 */
@Slf4j
@Component
public class AggregateMerger {

    private final long deadlineOffsetSeconds;

    @Autowired
    public AggregateMerger(AggregationProperties properties) {
        this(properties.getDeadlineOffsetSeconds());
    }

    public AggregateMerger(long deadlineOffsetSeconds) {
        this.deadlineOffsetSeconds = deadlineOffsetSeconds;
    }

    public Map<BigInteger, RandomnessRequest> merge(Map<BigInteger, RandomnessRequest> existing,
                                                    List<? extends DomainEvent> events) {
        Map<BigInteger, RandomnessRequest> merged = new LinkedHashMap<>(existing);
        Map<BigInteger, List<DomainEvent>> byRequest = partition(events);
        int orphans = 0;
        for (Map.Entry<BigInteger, List<DomainEvent>> partition : byRequest.entrySet()) {
            List<DomainEvent> ordered = partition.getValue();
            ordered.sort(DomainEvent.CHAIN_ORDER);
            for (DomainEvent event : ordered) {
                if (!apply(merged, event)) {
                    orphans++;
                }
            }
        }
        if (orphans > 0) {
            log.debug("Dropped {} orphan fulfilment/failure event(s) with no matching request", orphans);
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * @return false when the event is an orphan
     */
    private boolean apply(Map<BigInteger, RandomnessRequest> aggregates, DomainEvent event) {
        RandomnessRequest current = aggregates.get(event.requestId());
        if (event instanceof RandomnessRequestedEvent requested) {
            if (current == null) {
                aggregates.put(requested.requestId(), RandomnessRequest.pending(requested, deadlineOffsetSeconds));
            }
            return true;
        }
        if (current == null) {
            log.debug("Orphan {} for request {} (tx={}, logIndex={})",
                    event.kind(), event.requestId(), event.txHash(), event.logIndex());
            return false;
        }
        if (!current.isPending()) {
            return true;
        }
        if (event instanceof RandomnessFulfilledEvent fulfilled) {
            aggregates.put(current.id(), current.fulfilled(fulfilled));
        } else if (event instanceof RandomnessCallbackFailedEvent failed) {
            aggregates.put(current.id(), current.failed(failed));
        }
        return true;
    }

    private static Map<BigInteger, List<DomainEvent>> partition(List<? extends DomainEvent> events) {
        Map<EventKey, DomainEvent> unique = new LinkedHashMap<>();
        for (DomainEvent event : events) {
            unique.putIfAbsent(event.key(), event);
        }
        Map<BigInteger, List<DomainEvent>> byRequest = new TreeMap<>();
        for (DomainEvent event : unique.values()) {
            byRequest.computeIfAbsent(event.requestId(), k -> new ArrayList<>()).add(event);
        }
        return byRequest;
    }
}
