package com.vrfradar.ingestion.adapter;

import com.vrfradar.domain.BlockRef;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only chain query capability. Calls never retry; failures are signalled as errors on the returned Mono.
 */
public interface LedgerReader {

    /**
     * Latest block number (inclusive).
     */
    Mono<Long> currentBlockHeight();

    /**
     * Logs of the coordinator contract whose topic0 is the keccak-256 of {@code eventSignature}.
     *
     * @param eventSignature canonical ABI signature, e.g. {@code RandomnessFulfilled(uint256,uint256,bool,uint256)}
     * @param fromBlock      inclusive
     * @param toBlock        inclusive
     */
    Mono<List<RawLog>> getLogs(String eventSignature, long fromBlock, long toBlock);

    Mono<BlockRef> getBlock(long number);

    /**
     * Headers for several blocks. Implementations may batch; the default issues one call per block.
     */
    default Mono<Map<Long, BlockRef>> getBlocks(Collection<Long> numbers) {
        return Flux.fromIterable(numbers)
                .distinct()
                .flatMap(this::getBlock)
                .collectMap(BlockRef::number);
    }
}
