package com.vrfradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Ledger access: RPC endpoints, coordinator contract, block window size and RPC budget.
 */
@ConfigurationProperties(prefix = "vrfradar.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> urls = new ArrayList<>(List.of("https://sepolia-rpc.scroll.io"));

    /** Coordinator contract whose events are read. Null reads the topic from every contract. */
    private String coordinatorAddress;

    /** Blocks per window page. Default ~2h of Scroll blocks at 3 s. */
    private long windowBlocks = 2_400;

    /** Upper bound for one ledger call, including rate-limiter wait. */
    private long requestTimeoutMs = 10_000;

    /** RPC budget (requests per second) for this instance. */
    private int maxRequestsPerSecond = 25;

    /** How long a call may wait for an RPC permit before failing. */
    private long localLimiterTimeoutMs = 2_000;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }
}
