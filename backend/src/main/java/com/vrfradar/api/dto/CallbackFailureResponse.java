package com.vrfradar.api.dto;

import com.vrfradar.domain.CallbackFailure;

public record CallbackFailureResponse(
        String retdata,
        String gasLimit,
        String actualGasUsed,
        String transactionHash,
        long blockNumber,
        long timestamp
) {

    public static CallbackFailureResponse from(CallbackFailure f) {
        return new CallbackFailureResponse(f.retdata(), f.gasLimit().toString(), f.actualGasUsed().toString(),
                f.transactionHash(), f.blockNumber(), f.timestamp());
    }
}
