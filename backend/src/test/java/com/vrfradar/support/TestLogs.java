package com.vrfradar.support;

import com.vrfradar.domain.EventKind;
import com.vrfradar.ingestion.adapter.RawLog;
import com.vrfradar.ingestion.decoder.CoordinatorEvents;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

/**
 * ABI-encoded coordinator logs for tests.
 */
public final class TestLogs {

    public static final String COORDINATOR = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
    public static final String ALICE = "0x00000000000000000000000000000000000000a1";
    public static final String BOB = "0x00000000000000000000000000000000000000b2";
    public static final String PUB_KEY_HASH = word(BigInteger.valueOf(0xabcdef));
    public static final long GENESIS_TIME = 1_700_000_000L;

    private TestLogs() {
    }

    /** Block timestamps in tests advance 3 s per block. */
    public static long timeOf(long block) {
        return GENESIS_TIME + block * 3;
    }

    public static RawLog requested(long id, String requester, long block, int logIndex, long callbackGasLimit, long fee) {
        return new RawLog(COORDINATOR,
                List.of(CoordinatorEvents.topic(EventKind.REQUESTED), word(id), addressTopic(requester), PUB_KEY_HASH),
                words(1, callbackGasLimit, fee, 1_000_000_000L),
                block, null, txHash(block, logIndex), logIndex);
    }

    public static RawLog fulfilled(long id, long block, int logIndex, long randomness, boolean callbackSuccess) {
        return new RawLog(COORDINATOR,
                List.of(CoordinatorEvents.topic(EventKind.FULFILLED), word(id)),
                words(randomness, callbackSuccess ? 1 : 0, 45_000),
                block, null, txHash(block, logIndex), logIndex);
    }

    public static RawLog callbackFailed(long id, long block, int logIndex) {
        return new RawLog(COORDINATOR,
                List.of(CoordinatorEvents.topic(EventKind.CALLBACK_FAILED), word(id)),
                words(0xdead, 100_000, 100_000),
                block, null, txHash(block, logIndex), logIndex);
    }

    public static RawLog withTimestamp(RawLog log) {
        return new RawLog(log.address(), log.topics(), log.data(), log.blockNumber(), timeOf(log.blockNumber()),
                log.transactionHash(), log.logIndex());
    }

    public static String txHash(long block, int logIndex) {
        return word(BigInteger.valueOf(block * 1_000 + logIndex + 0x1000));
    }

    public static String word(long value) {
        return word(BigInteger.valueOf(value));
    }

    public static String word(BigInteger value) {
        return "0x" + Numeric.toHexStringNoPrefixZeroPadded(value, 64);
    }

    public static String addressTopic(String address) {
        return "0x" + "0".repeat(24) + address.substring(2);
    }

    public static String words(long... values) {
        StringBuilder sb = new StringBuilder("0x");
        for (long value : values) {
            sb.append(Numeric.toHexStringNoPrefixZeroPadded(BigInteger.valueOf(value), 64));
        }
        return sb.toString();
    }
}
