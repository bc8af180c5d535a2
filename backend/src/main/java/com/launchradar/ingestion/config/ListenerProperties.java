package com.launchradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Real-time listener settings.
 */
@ConfigurationProperties(prefix = "launchradar.ingestion.listener")
@NoArgsConstructor
@Getter
@Setter
public class ListenerProperties {

    private boolean enabled = true;

    private long reconnectBaseDelayMs = 2_000;

    private long reconnectMaxDelayMs = 60_000;

    /** After this many failed reconnects the chain is dropped from tracking until restart. */
    private int reconnectMaxAttempts = 10;

    /** Blocks searched backwards from head when a notification carries no transaction hash. */
    private int metadataLookbackBlocks = 10;

    private int frameQueueCapacity = 1_024;
}
