package com.vrfradar.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

/**
 * Merged view of one randomness request. Transaction hash, block number and timestamp are those of the
 * creating {@code RandomnessRequested} log. {@code deadline} is an estimate (creation timestamp plus a fixed
 * offset) because the event does not carry the on-chain value.
 */
public record RandomnessRequest(
        BigInteger id,
        String requester,
        long deadline,
        BigInteger callbackGasLimit,
        BigInteger feePaid,
        BigInteger effectiveFeePerGas,
        RequestStatus status,
        String transactionHash,
        long blockNumber,
        long timestamp,
        String pubKeyHash,
        BigInteger round,
        Optional<RandomnessFulfillment> fulfillment,
        Optional<CallbackFailure> failure
) {

    public static RandomnessRequest pending(RandomnessRequestedEvent event, long deadlineOffsetSeconds) {
        return new RandomnessRequest(
                event.requestId(),
                event.requester(),
                event.block().timestamp() + deadlineOffsetSeconds,
                event.callbackGasLimit(),
                event.feePaid(),
                event.effectiveFeePerGas(),
                RequestStatus.PENDING,
                event.txHash(),
                event.block().number(),
                event.block().timestamp(),
                event.pubKeyHash(),
                event.round(),
                Optional.empty(),
                Optional.empty());
    }

    public RandomnessRequest fulfilled(RandomnessFulfilledEvent event) {
        requirePending(RequestStatus.FULFILLED);
        return new RandomnessRequest(id, requester, deadline, callbackGasLimit, feePaid, effectiveFeePerGas,
                RequestStatus.FULFILLED, transactionHash, blockNumber, timestamp, pubKeyHash, round,
                Optional.of(RandomnessFulfillment.of(event)), Optional.empty());
    }

    public RandomnessRequest failed(RandomnessCallbackFailedEvent event) {
        requirePending(RequestStatus.FAILED);
        return new RandomnessRequest(id, requester, deadline, callbackGasLimit, feePaid, effectiveFeePerGas,
                RequestStatus.FAILED, transactionHash, blockNumber, timestamp, pubKeyHash, round,
                Optional.empty(), Optional.of(CallbackFailure.of(event)));
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    /**
     * A pending request whose deadline has passed can be fulfilled by an operator.
     */
    public boolean isFulfillable(Instant now) {
        return isPending() && deadline < now.getEpochSecond();
    }

    /** Negative once the deadline has passed. */
    public long secondsUntilDeadline(Instant now) {
        return deadline - now.getEpochSecond();
    }

    private void requirePending(RequestStatus target) {
        if (status != RequestStatus.PENDING) {
            throw new IllegalStateException("request " + id + " cannot move from " + status + " to " + target);
        }
    }
}
