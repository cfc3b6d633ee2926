package com.vrfradar.domain;

/**
 * Block provenance attached to every event and aggregate. Timestamp is epoch seconds.
 */
public record BlockRef(long number, long timestamp) {

    public BlockRef {
        if (number < 0) {
            throw new IllegalArgumentException("block number must be >= 0: " + number);
        }
    }
}
