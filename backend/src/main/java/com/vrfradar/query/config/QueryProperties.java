package com.vrfradar.query.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Query cache and refresh policy.
 */
@ConfigurationProperties(prefix = "vrfradar.query")
@NoArgsConstructor
@Getter
@Setter
public class QueryProperties {

    /** A READY entry younger than this is served without touching the ledger. */
    private long staleTimeMs = 30_000;

    /** Entries not read for this long are evicted. */
    private long cacheTtlMs = 300_000;

    private long cacheMaxSize = 200;

    /** Period of the stale-entry refresh of the active query. */
    private long refreshIntervalMs = 60_000;

    /** Upper bound for pageSize accepted over HTTP. */
    private int maxPageSize = 100;
}
