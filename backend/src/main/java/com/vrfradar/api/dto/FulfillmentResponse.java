package com.vrfradar.api.dto;

import com.vrfradar.domain.RandomnessFulfillment;

public record FulfillmentResponse(
        String randomness,
        boolean callbackSuccess,
        String actualGasUsed,
        String transactionHash,
        long blockNumber,
        long timestamp
) {

    public static FulfillmentResponse from(RandomnessFulfillment f) {
        return new FulfillmentResponse(f.randomness().toString(), f.callbackSuccess(), f.actualGasUsed().toString(),
                f.transactionHash(), f.blockNumber(), f.timestamp());
    }
}
