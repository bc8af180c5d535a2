package com.launchradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backfill scanner config. One catch-up pass per chain from the start block to head, window by window.
 */
@ConfigurationProperties(prefix = "launchradar.ingestion.backfill")
@NoArgsConstructor
@Getter
@Setter
public class BackfillProperties {

    private boolean enabled = true;

    /** First block to scan when no cursor was persisted. A per-chain start-block overrides it. */
    private long startBlock = 0;

    /** Blocks added to the cursor per tick; the scanned range is [cursor, cursor + windowBlocks]. */
    private long windowBlocks = 100;

    private long tickIntervalMs = 10_000;

    /** Smallest range that is still split in half when the RPC rejects a range as too wide. */
    private long minSplitBlocks = 2;
}
