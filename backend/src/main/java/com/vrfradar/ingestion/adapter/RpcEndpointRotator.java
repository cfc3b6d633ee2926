package com.vrfradar.ingestion.adapter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin RPC endpoint selection. Spreads load across the configured endpoints; a failed call is not
 * retried on the next endpoint, the next call simply lands there.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);

    public RpcEndpointRotator(List<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
    }

    /**
     * Next endpoint in round-robin order.
     */
    public String getNextEndpoint() {
        int i = index.getAndIncrement() % endpoints.size();
        if (i < 0) {
            i += endpoints.size();
        }
        return endpoints.get(i);
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
