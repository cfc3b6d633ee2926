package com.vrfradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vrfradar.ingestion.adapter.LedgerAdapter;
import com.vrfradar.ingestion.adapter.LedgerReader;
import com.vrfradar.ingestion.adapter.RpcEndpointRotator;
import com.vrfradar.ingestion.adapter.evm.EvmLedgerReader;
import com.vrfradar.ingestion.adapter.evm.EvmRpcClient;
import com.vrfradar.ingestion.adapter.evm.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the EVM ledger reader and the guarded adapter from {@link LedgerProperties}.
 */
@Configuration
public class LedgerAdapterConfig {

    @Bean
    public RpcEndpointRotator ledgerRpcEndpointRotator(LedgerProperties properties) {
        return new RpcEndpointRotator(properties.getUrls());
    }

    @Bean
    @ConditionalOnMissingBean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerReader ledgerReader(EvmRpcClient rpcClient, RpcEndpointRotator ledgerRpcEndpointRotator,
                                     ObjectMapper objectMapper, LedgerProperties properties) {
        return new EvmLedgerReader(rpcClient, ledgerRpcEndpointRotator, objectMapper, properties.getCoordinatorAddress());
    }

    @Bean(name = "ledgerRpcRateLimiter")
    public RateLimiter ledgerRpcRateLimiter(LedgerProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ledger-rpc", config);
    }

    @Bean
    public LedgerAdapter ledgerAdapter(LedgerReader ledgerReader, RateLimiter ledgerRpcRateLimiter,
                                       LedgerProperties properties) {
        return new LedgerAdapter(ledgerReader, ledgerRpcRateLimiter,
                Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())));
    }
}
