package com.vrfradar.domain;

/**
 * Dedup key of an on-chain log: the same (txHash, logIndex) is the same event.
 */
public record EventKey(String txHash, int logIndex) {
}
