package com.vrfradar.domain;

import java.math.BigInteger;

public record RandomnessFulfilledEvent(
        BigInteger requestId,
        BigInteger randomness,
        boolean callbackSuccess,
        BigInteger actualGasUsed,
        BlockRef block,
        String txHash,
        int logIndex
) implements DomainEvent {

    @Override
    public EventKind kind() {
        return EventKind.FULFILLED;
    }
}
