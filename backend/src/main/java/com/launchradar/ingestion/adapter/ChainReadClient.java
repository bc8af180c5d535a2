package com.launchradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.launchradar.domain.ChainId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to one chain, bound to its RPC endpoints and bonding-curve contract.
 */
public interface ChainReadClient {

    ChainId chain();

    String contractAddress();

    long getBlockNumber();

    /**
     * Contract logs in {@code [fromBlock, toBlock]} whose topic0 is any of {@code eventTopics}; when
     * {@code indexedTopic1} is non-null the first indexed argument must match it.
     */
    List<JsonNode> getLogs(long fromBlock, long toBlock, List<String> eventTopics, String indexedTopic1);

    Optional<JsonNode> getTransactionReceipt(String txHash);

    Optional<Instant> getBlockTimestamp(long blockNumber);
}
