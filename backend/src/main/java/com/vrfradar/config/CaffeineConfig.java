package com.vrfradar.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vrfradar.query.QueryKey;
import com.vrfradar.query.QueryState;
import com.vrfradar.query.config.QueryProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process cache of query states, one entry per (window page, view parameters).
 */
@Configuration
public class CaffeineConfig {

    public static final String QUERY_STATE_CACHE = "queryStateCache";

    @Bean(name = QUERY_STATE_CACHE)
    public Cache<QueryKey, QueryState> queryStateCache(QueryProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterAccess(properties.getCacheTtlMs(), TimeUnit.MILLISECONDS)
                .maximumSize(properties.getCacheMaxSize())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
