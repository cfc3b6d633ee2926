package com.vrfradar.domain;

/**
 * The three coordinator events the aggregation engine consumes.
 * {@link #signature()} is the canonical ABI form hashed into topic0.
 */
public enum EventKind {

    REQUESTED("RandomnessRequested", "RandomnessRequested(uint256,address,bytes32,uint256,uint256,uint256,uint256)"),
    FULFILLED("RandomnessFulfilled", "RandomnessFulfilled(uint256,uint256,bool,uint256)"),
    CALLBACK_FAILED("RandomnessCallbackFailed", "RandomnessCallbackFailed(uint256,bytes32,uint256,uint256)");

    private final String eventName;
    private final String signature;

    EventKind(String eventName, String signature) {
        this.eventName = eventName;
        this.signature = signature;
    }

    public String eventName() {
        return eventName;
    }

    public String signature() {
        return signature;
    }
}
