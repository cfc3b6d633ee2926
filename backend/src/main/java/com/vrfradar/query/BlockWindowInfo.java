package com.vrfradar.query;

import com.vrfradar.domain.WindowCursor;

public record BlockWindowInfo(long currentBlock, long fromBlock, long toBlock, long blockRange) {

    public static BlockWindowInfo of(long currentBlock, WindowCursor window) {
        return new BlockWindowInfo(currentBlock, window.fromBlock(), window.toBlock(), window.blockRange());
    }
}
