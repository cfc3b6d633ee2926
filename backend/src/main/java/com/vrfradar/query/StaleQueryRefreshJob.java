package com.vrfradar.query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic refresh of the active query once its data has gone stale. Failed queries are retried here too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleQueryRefreshJob {

    private final RequestQueryOrchestrator orchestrator;

    @Scheduled(fixedDelayString = "${vrfradar.query.refresh-interval-ms:60000}",
            initialDelayString = "${vrfradar.query.refresh-interval-ms:60000}")
    public void refresh() {
        if (orchestrator.refreshActiveIfStale()) {
            log.debug("Stale active query refresh started");
        }
    }
}
