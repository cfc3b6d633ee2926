package com.vrfradar.support;

import com.vrfradar.domain.BlockRef;
import com.vrfradar.domain.RandomnessCallbackFailedEvent;
import com.vrfradar.domain.RandomnessFulfilledEvent;
import com.vrfradar.domain.RandomnessRequestedEvent;

import java.math.BigInteger;

/**
 * Decoded coordinator events for merge and view tests.
 */
public final class TestEvents {

    private TestEvents() {
    }

    public static RandomnessRequestedEvent requested(long id, long fee, long block, int logIndex) {
        return requested(id, TestLogs.ALICE, fee, 100_000, block, logIndex);
    }

    public static RandomnessRequestedEvent requested(long id, String requester, long fee, long callbackGasLimit,
                                                     long block, int logIndex) {
        return new RandomnessRequestedEvent(BigInteger.valueOf(id), requester, TestLogs.PUB_KEY_HASH, BigInteger.ONE,
                BigInteger.valueOf(callbackGasLimit), BigInteger.valueOf(fee), BigInteger.valueOf(1_000_000_000L),
                block(block), TestLogs.txHash(block, logIndex), logIndex);
    }

    public static RandomnessFulfilledEvent fulfilled(long id, long randomness, long block, int logIndex) {
        return new RandomnessFulfilledEvent(BigInteger.valueOf(id), BigInteger.valueOf(randomness), true,
                BigInteger.valueOf(45_000), block(block), TestLogs.txHash(block, logIndex), logIndex);
    }

    public static RandomnessCallbackFailedEvent callbackFailed(long id, long block, int logIndex) {
        return new RandomnessCallbackFailedEvent(BigInteger.valueOf(id), TestLogs.word(0xdead),
                BigInteger.valueOf(100_000), BigInteger.valueOf(100_000), block(block), TestLogs.txHash(block, logIndex), logIndex);
    }

    public static BlockRef block(long number) {
        return new BlockRef(number, TestLogs.timeOf(number));
    }
}
