package com.vrfradar.domain;

import java.math.BigInteger;

/**
 * Emitted when the consumer callback reverted; {@code retdata} is the first 32 bytes of the revert data.
 */
public record RandomnessCallbackFailedEvent(
        BigInteger requestId,
        String retdata,
        BigInteger gasLimit,
        BigInteger actualGasUsed,
        BlockRef block,
        String txHash,
        int logIndex
) implements DomainEvent {

    @Override
    public EventKind kind() {
        return EventKind.CALLBACK_FAILED;
    }
}
