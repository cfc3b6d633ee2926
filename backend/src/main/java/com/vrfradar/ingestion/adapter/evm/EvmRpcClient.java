package com.vrfradar.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * EVM JSON-RPC transport, separated from {@link EvmLedgerReader} so tests can script responses.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params (e.g. filter object)
     * @return response body as string (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);

    /**
     * JSON-RPC batch call: send multiple requests in one HTTP request. Request ids are 1-based positions.
     *
     * @return response body as string (JSON array); errors on HTTP failure
     */
    Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests);
}
