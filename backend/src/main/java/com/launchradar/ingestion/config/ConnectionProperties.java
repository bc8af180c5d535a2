package com.launchradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Socket connection creation settings, including the rate-limit cool-down applied per chain.
 */
@ConfigurationProperties(prefix = "launchradar.ingestion.connection")
@NoArgsConstructor
@Getter
@Setter
public class ConnectionProperties {

    private long rateLimitBaseDelayMs = 180_000;

    private long rateLimitMaxDelayMs = 3_600_000;

    /** Exponent cap: the window stops doubling after this many consecutive rate-limit signals. */
    private int rateLimitMaxExponent = 6;

    private long connectTimeoutMs = 15_000;
}
