package com.vrfradar.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vrfradar.common.HexQuantity;
import com.vrfradar.domain.BlockRef;
import com.vrfradar.ingestion.adapter.LedgerReader;
import com.vrfradar.ingestion.adapter.LedgerUnavailableException;
import com.vrfradar.ingestion.adapter.RawLog;
import com.vrfradar.ingestion.adapter.RpcEndpointRotator;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger reader over EVM JSON-RPC: eth_blockNumber, eth_getLogs filtered by the coordinator address and topic0,
 * eth_getBlockByNumber (batched for several blocks). Every call goes to the next endpoint of the rotator.
 */
@Slf4j
public class EvmLedgerReader implements LedgerReader {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final ObjectMapper objectMapper;
    private final String coordinatorAddress;
    private final Map<String, String> topicBySignature = new ConcurrentHashMap<>();

    public EvmLedgerReader(EvmRpcClient rpcClient, RpcEndpointRotator rotator, ObjectMapper objectMapper,
                           String coordinatorAddress) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.objectMapper = objectMapper;
        this.coordinatorAddress = HexQuantity.normalize(coordinatorAddress);
    }

    @Override
    public Mono<Long> currentBlockHeight() {
        String endpoint = rotator.getNextEndpoint();
        return rpcClient.call(endpoint, "eth_blockNumber", Collections.emptyList())
                .map(json -> {
                    JsonNode result = resultOf(json, "eth_blockNumber");
                    return parseQuantity(result.asText(null), "eth_blockNumber result");
                });
    }

    @Override
    public Mono<List<RawLog>> getLogs(String eventSignature, long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            return Mono.just(List.of());
        }
        String topic0 = topicBySignature.computeIfAbsent(eventSignature, Hash::sha3String);
        Map<String, Object> filter = new HashMap<>();
        filter.put("fromBlock", HexQuantity.toHex(fromBlock));
        filter.put("toBlock", HexQuantity.toHex(toBlock));
        filter.put("topics", List.of(topic0));
        if (coordinatorAddress != null) {
            filter.put("address", coordinatorAddress);
        }
        String endpoint = rotator.getNextEndpoint();
        return rpcClient.call(endpoint, "eth_getLogs", Collections.singletonList(filter))
                .map(json -> {
                    JsonNode result = resultOf(json, "eth_getLogs");
                    if (!result.isArray()) {
                        throw new LedgerUnavailableException("eth_getLogs result is not an array");
                    }
                    List<RawLog> logs = new ArrayList<>(result.size());
                    for (JsonNode node : result) {
                        if (node.path("removed").asBoolean(false)) {
                            continue;
                        }
                        try {
                            logs.add(toRawLog(node));
                        } catch (IllegalArgumentException | ArithmeticException e) {
                            log.warn("Skipping malformed eth_getLogs entry tx={} on {}: {}",
                                    node.path("transactionHash").asText(null), endpoint, e.getMessage());
                        }
                    }
                    log.debug("eth_getLogs {} [{}-{}] on {}: {} log(s)", eventSignature, fromBlock, toBlock, endpoint, logs.size());
                    return logs;
                });
    }

    @Override
    public Mono<BlockRef> getBlock(long number) {
        String endpoint = rotator.getNextEndpoint();
        return rpcClient.call(endpoint, "eth_getBlockByNumber", List.of(HexQuantity.toHex(number), false))
                .map(json -> toBlockRef(resultOf(json, "eth_getBlockByNumber"), number));
    }

    @Override
    public Mono<Map<Long, BlockRef>> getBlocks(Collection<Long> numbers) {
        List<Long> distinct = numbers.stream().distinct().sorted().toList();
        if (distinct.isEmpty()) {
            return Mono.just(Map.of());
        }
        if (distinct.size() == 1) {
            return getBlock(distinct.get(0)).map(b -> Map.of(b.number(), b));
        }
        List<RpcRequest> requests = distinct.stream()
                .map(n -> new RpcRequest("eth_getBlockByNumber", List.of(HexQuantity.toHex(n), false)))
                .toList();
        String endpoint = rotator.getNextEndpoint();
        return rpcClient.batchCall(endpoint, requests)
                .map(json -> parseBatchBlocks(json, distinct));
    }

    private Map<Long, BlockRef> parseBatchBlocks(String json, List<Long> requested) {
        JsonNode root = readTree(json, "batch eth_getBlockByNumber");
        if (!root.isArray()) {
            throw new LedgerUnavailableException("Batch eth_getBlockByNumber: expected array, got " + root.getNodeType());
        }
        Map<Integer, JsonNode> byId = new HashMap<>();
        for (JsonNode resp : root) {
            byId.put(resp.path("id").asInt(), resp);
        }
        Map<Long, BlockRef> blocks = new LinkedHashMap<>();
        for (int i = 0; i < requested.size(); i++) {
            long number = requested.get(i);
            JsonNode resp = byId.get(i + 1);
            if (resp == null) {
                throw new LedgerUnavailableException("Batch eth_getBlockByNumber: missing response for block " + number);
            }
            JsonNode error = resp.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                throw new LedgerUnavailableException("eth_getBlockByNumber error: " + error);
            }
            blocks.put(number, toBlockRef(resp.path("result"), number));
        }
        return blocks;
    }

    private RawLog toRawLog(JsonNode node) {
        List<String> topics = new ArrayList<>();
        node.path("topics").forEach(t -> topics.add(HexQuantity.normalize(t.asText())));
        String timestampHex = node.path("blockTimestamp").asText(null);
        Long blockTimestamp = HexQuantity.isHex(timestampHex) ? HexQuantity.parseLong(timestampHex) : null;
        return new RawLog(
                HexQuantity.normalize(node.path("address").asText(null)),
                topics,
                HexQuantity.normalize(node.path("data").asText("0x")),
                parseLogField(node.path("blockNumber").asText(null), "blockNumber"),
                blockTimestamp,
                HexQuantity.normalize(node.path("transactionHash").asText(null)),
                Math.toIntExact(parseLogField(node.path("logIndex").asText(null), "logIndex")));
    }

    private BlockRef toBlockRef(JsonNode result, long number) {
        if (result.isMissingNode() || result.isNull()) {
            throw new LedgerUnavailableException("eth_getBlockByNumber no result for block " + number);
        }
        long timestamp = parseQuantity(result.path("timestamp").asText(null), "block timestamp");
        return new BlockRef(number, timestamp);
    }

    private JsonNode resultOf(String json, String method) {
        if (json == null) {
            throw new LedgerUnavailableException(method + " returned null");
        }
        JsonNode root = readTree(json, method);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new LedgerUnavailableException(method + " error: " + error);
        }
        return root.path("result");
    }

    private JsonNode readTree(String json, String what) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LedgerUnavailableException("Failed to parse " + what + " response", e);
        }
    }

    /** Per-log fields: a bad value rejects that log only. */
    private static long parseLogField(String hex, String field) {
        try {
            return HexQuantity.parseLong(hex);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("invalid log " + field + ": " + hex, e);
        }
    }

    private static long parseQuantity(String hex, String what) {
        try {
            return HexQuantity.parseLong(hex);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new LedgerUnavailableException("Invalid " + what + ": " + hex, e);
        }
    }
}
