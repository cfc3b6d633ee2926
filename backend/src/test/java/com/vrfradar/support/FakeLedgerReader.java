package com.vrfradar.support;

import com.vrfradar.domain.BlockRef;
import com.vrfradar.ingestion.adapter.LedgerReader;
import com.vrfradar.ingestion.adapter.LedgerUnavailableException;
import com.vrfradar.ingestion.adapter.RawLog;
import org.web3j.crypto.Hash;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory chain. Log fetches see the logs present when they are issued and are held back until the gate completes.
 */
public class FakeLedgerReader implements LedgerReader {

    private final List<RawLog> logs = new CopyOnWriteArrayList<>();
    private final AtomicInteger heightCalls = new AtomicInteger();
    private final AtomicInteger logCalls = new AtomicInteger();
    private volatile long height;
    private volatile String failure;
    private volatile Mono<Void> gate = Mono.empty();

    public FakeLedgerReader(long height) {
        this.height = height;
    }

    public FakeLedgerReader add(RawLog... newLogs) {
        logs.addAll(List.of(newLogs));
        return this;
    }

    public void setHeight(long height) {
        this.height = height;
    }

    public void failWith(String message) {
        this.failure = message;
    }

    public void recover() {
        this.failure = null;
    }

    public void setGate(Mono<Void> gate) {
        this.gate = gate;
    }

    public int heightCalls() {
        return heightCalls.get();
    }

    public int logCalls() {
        return logCalls.get();
    }

    @Override
    public Mono<Long> currentBlockHeight() {
        heightCalls.incrementAndGet();
        return failure != null ? Mono.error(new LedgerUnavailableException(failure)) : Mono.just(height);
    }

    @Override
    public Mono<List<RawLog>> getLogs(String eventSignature, long fromBlock, long toBlock) {
        logCalls.incrementAndGet();
        if (failure != null) {
            return Mono.error(new LedgerUnavailableException(failure));
        }
        String topic0 = Hash.sha3String(eventSignature);
        List<RawLog> snapshot = logs.stream()
                .filter(l -> topic0.equalsIgnoreCase(l.topic0()))
                .filter(l -> l.blockNumber() >= fromBlock && l.blockNumber() <= toBlock)
                .toList();
        return gate.then(Mono.just(snapshot));
    }

    @Override
    public Mono<BlockRef> getBlock(long number) {
        return Mono.just(new BlockRef(number, TestLogs.timeOf(number)));
    }
}
