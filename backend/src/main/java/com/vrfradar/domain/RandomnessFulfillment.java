package com.vrfradar.domain;

import java.math.BigInteger;

/**
 * Fulfilment details, provenance of the {@code RandomnessFulfilled} log.
 */
public record RandomnessFulfillment(
        BigInteger requestId,
        BigInteger randomness,
        boolean callbackSuccess,
        BigInteger actualGasUsed,
        String transactionHash,
        long blockNumber,
        long timestamp
) {

    public static RandomnessFulfillment of(RandomnessFulfilledEvent event) {
        return new RandomnessFulfillment(
                event.requestId(),
                event.randomness(),
                event.callbackSuccess(),
                event.actualGasUsed(),
                event.txHash(),
                event.block().number(),
                event.block().timestamp());
    }
}
