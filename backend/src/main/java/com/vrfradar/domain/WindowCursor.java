package com.vrfradar.domain;

/**
 * Contiguous, inclusive block range scanned for one window page. Page 0 is the most recent window.
 * Independent of result-set pagination.
 */
public record WindowCursor(long fromBlock, long toBlock, int pageIndex, boolean hasMorePages) {

    public long blockRange() {
        return toBlock - fromBlock + 1;
    }

    public boolean contains(long blockNumber) {
        return blockNumber >= fromBlock && blockNumber <= toBlock;
    }
}
