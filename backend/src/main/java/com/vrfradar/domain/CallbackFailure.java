package com.vrfradar.domain;

import java.math.BigInteger;

/**
 * Details of a reverted consumer callback, provenance of the {@code RandomnessCallbackFailed} log.
 */
public record CallbackFailure(
        BigInteger requestId,
        String retdata,
        BigInteger gasLimit,
        BigInteger actualGasUsed,
        String transactionHash,
        long blockNumber,
        long timestamp
) {

    public static CallbackFailure of(RandomnessCallbackFailedEvent event) {
        return new CallbackFailure(
                event.requestId(),
                event.retdata(),
                event.gasLimit(),
                event.actualGasUsed(),
                event.txHash(),
                event.block().number(),
                event.block().timestamp());
    }
}
