package com.vrfradar.aggregation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Aggregate derivation settings.
 */
@ConfigurationProperties(prefix = "vrfradar.aggregation")
@NoArgsConstructor
@Getter
@Setter
public class AggregationProperties {

    /**
     * Offset added to the request block timestamp to estimate the deadline. The request event does not carry
     * the on-chain deadline, so the value is advisory.
     */
    private long deadlineOffsetSeconds = 7_200;
}
