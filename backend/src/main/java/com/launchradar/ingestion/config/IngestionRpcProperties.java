package com.launchradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * HTTP JSON-RPC throttling and retry settings shared by all chains.
 */
@ConfigurationProperties(prefix = "launchradar.ingestion.rpc")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRpcProperties {

    /** RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 25;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long limiterTimeoutMs = 2_000;

    private long requestTimeoutMs = 10_000;

    private long retryBaseDelayMs = 1_000;

    private double retryJitterFactor = 0.2;

    private int retryMaxAttempts = 3;
}
