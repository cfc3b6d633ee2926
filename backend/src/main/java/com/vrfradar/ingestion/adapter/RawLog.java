package com.vrfradar.ingestion.adapter;

import java.util.List;

/**
 * One {@code eth_getLogs} entry as returned by the ledger, before decoding.
 * {@code blockTimestamp} is null unless the node includes it in log objects.
 */
public record RawLog(
        String address,
        List<String> topics,
        String data,
        long blockNumber,
        Long blockTimestamp,
        String transactionHash,
        int logIndex
) {

    public RawLog {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }

    public String topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }
}
