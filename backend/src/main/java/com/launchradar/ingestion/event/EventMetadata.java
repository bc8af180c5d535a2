package com.launchradar.ingestion.event;

/**
 * Where a log sits on chain. {@code blockNumber} is 0 when only the hash could be resolved.
 */
public record EventMetadata(String txHash, long blockNumber, long logIndex, Source source) {

    public enum Source {
        NESTED_LOG,
        DIRECT,
        LOG_QUERY,
        RECEIPT
    }
}
