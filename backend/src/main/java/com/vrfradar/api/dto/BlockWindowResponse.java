package com.vrfradar.api.dto;

import com.vrfradar.query.BlockWindowInfo;

public record BlockWindowResponse(long currentBlock, long fromBlock, long toBlock, long blockRange) {

    public static BlockWindowResponse from(BlockWindowInfo info) {
        return new BlockWindowResponse(info.currentBlock(), info.fromBlock(), info.toBlock(), info.blockRange());
    }
}
