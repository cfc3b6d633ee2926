package com.vrfradar.query;

import com.vrfradar.live.Unsubscribe;
import com.vrfradar.live.config.LiveUpdateProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Keeps the orchestrator subscribed to the chain tip from application start until shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveUpdateRegistration {

    private final RequestQueryOrchestrator orchestrator;
    private final LiveUpdateProperties properties;

    private volatile Unsubscribe subscription;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!properties.isEnabled()) {
            log.info("Live updates disabled");
            return;
        }
        subscription = orchestrator.subscribe(events ->
                log.info("{} new randomness request(s) at the tip, latest window refreshed", events.size()));
        log.info("Live updates started, polling every {} ms", properties.getPollIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        Unsubscribe current = subscription;
        subscription = null;
        if (current != null) {
            current.unsubscribe();
        }
    }
}
