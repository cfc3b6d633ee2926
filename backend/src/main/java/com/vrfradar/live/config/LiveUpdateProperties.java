package com.vrfradar.live.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vrfradar.live")
@NoArgsConstructor
@Getter
@Setter
public class LiveUpdateProperties {

    /** Whether the application subscribes to the chain tip on startup. */
    private boolean enabled = true;

    private long pollIntervalMs = 4_000;

    /** After an outage only the most recent blocks are scanned. */
    private long maxBlocksPerPoll = 2_400;
}
