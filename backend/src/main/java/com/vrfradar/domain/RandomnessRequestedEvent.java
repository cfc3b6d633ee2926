package com.vrfradar.domain;

import java.math.BigInteger;

public record RandomnessRequestedEvent(
        BigInteger requestId,
        String requester,
        String pubKeyHash,
        BigInteger round,
        BigInteger callbackGasLimit,
        BigInteger feePaid,
        BigInteger effectiveFeePerGas,
        BlockRef block,
        String txHash,
        int logIndex
) implements DomainEvent {

    @Override
    public EventKind kind() {
        return EventKind.REQUESTED;
    }
}
