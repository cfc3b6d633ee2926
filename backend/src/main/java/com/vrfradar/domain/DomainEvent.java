package com.vrfradar.domain;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * A decoded coordinator event. Implementations are immutable records.
 */
public interface DomainEvent {

    /** Chain order: block number, then log index inside the block. */
    Comparator<DomainEvent> CHAIN_ORDER = Comparator
            .comparingLong((DomainEvent e) -> e.block().number())
            .thenComparingInt(DomainEvent::logIndex);

    BigInteger requestId();

    BlockRef block();

    String txHash();

    int logIndex();

    EventKind kind();

    default EventKey key() {
        return new EventKey(txHash(), logIndex());
    }
}
