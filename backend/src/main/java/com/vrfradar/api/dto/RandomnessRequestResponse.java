package com.vrfradar.api.dto;

import com.vrfradar.domain.RandomnessRequest;
import com.vrfradar.domain.RequestStatus;

import java.time.Instant;

/**
 * One request as served over HTTP. uint256 quantities are decimal strings.
 * {@code deadline} is estimated from the creation timestamp.
 */
public record RandomnessRequestResponse(
        String id,
        String requester,
        long deadline,
        String callbackGasLimit,
        String feePaid,
        String effectiveFeePerGas,
        RequestStatus status,
        String transactionHash,
        long blockNumber,
        long timestamp,
        String pubKeyHash,
        String round,
        boolean fulfillable,
        long secondsUntilDeadline,
        FulfillmentResponse fulfillment,
        CallbackFailureResponse failure
) {

    public static RandomnessRequestResponse from(RandomnessRequest r, Instant now) {
        return new RandomnessRequestResponse(
                r.id().toString(),
                r.requester(),
                r.deadline(),
                r.callbackGasLimit().toString(),
                r.feePaid().toString(),
                r.effectiveFeePerGas().toString(),
                r.status(),
                r.transactionHash(),
                r.blockNumber(),
                r.timestamp(),
                r.pubKeyHash(),
                r.round().toString(),
                r.isFulfillable(now),
                r.secondsUntilDeadline(now),
                r.fulfillment().map(FulfillmentResponse::from).orElse(null),
                r.failure().map(CallbackFailureResponse::from).orElse(null));
    }
}
