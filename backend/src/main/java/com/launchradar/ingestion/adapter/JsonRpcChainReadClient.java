package com.launchradar.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.domain.ChainId;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ChainReadClient} over HTTP JSON-RPC. Each call takes a permit from the shared limiter and is retried on
 * the next endpoint with backoff; range-too-wide errors are not retried so the caller can split the range.
 */
@Slf4j
public class JsonRpcChainReadClient implements ChainReadClient {

    private final ChainId chain;
    private final String contractAddress;
    private final ChainRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public JsonRpcChainReadClient(ChainId chain,
                                  String contractAddress,
                                  ChainRpcClient rpcClient,
                                  RpcEndpointRotator rotator,
                                  RateLimiter rateLimiter,
                                  ObjectMapper objectMapper) {
        this.chain = chain;
        this.contractAddress = contractAddress;
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChainId chain() {
        return chain;
    }

    @Override
    public String contractAddress() {
        return contractAddress;
    }

    @Override
    public long getBlockNumber() {
        JsonNode result = callWithRetry("eth_blockNumber", Collections.emptyList());
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException("eth_blockNumber invalid result on " + chain + ": " + hex);
        }
        return Long.parseLong(hex.substring(2), 16);
    }

    @Override
    public List<JsonNode> getLogs(long fromBlock, long toBlock, List<String> eventTopics, String indexedTopic1) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        Map<String, Object> filter = new HashMap<>();
        filter.put("address", contractAddress);
        filter.put("fromBlock", toHex(fromBlock));
        filter.put("toBlock", toHex(toBlock));
        List<Object> topics = new ArrayList<>();
        topics.add(List.copyOf(eventTopics));
        if (indexedTopic1 != null) {
            topics.add(indexedTopic1);
        }
        filter.put("topics", topics);
        JsonNode result = callWithRetry("eth_getLogs", Collections.singletonList(filter));
        if (!result.isArray()) {
            return List.of();
        }
        List<JsonNode> logs = new ArrayList<>();
        result.forEach(logs::add);
        return logs;
    }

    @Override
    public Optional<JsonNode> getTransactionReceipt(String txHash) {
        JsonNode result = callWithRetry("eth_getTransactionReceipt", Collections.singletonList(txHash));
        if (result.isMissingNode() || result.isNull()) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    @Override
    public Optional<Instant> getBlockTimestamp(long blockNumber) {
        JsonNode block = callWithRetry("eth_getBlockByNumber", Arrays.asList(toHex(blockNumber), false));
        String ts = block.path("timestamp").asText(null);
        if (ts == null || !ts.startsWith("0x")) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochSecond(Long.parseLong(ts.substring(2), 16)));
    }

    private JsonNode callWithRetry(String method, Object params) {
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return call(endpoint, method, params);
            } catch (RpcException e) {
                if (RpcErrors.isRangeTooWide(e)) {
                    throw e;
                }
                lastException = e;
                log.warn("{} on {} failed (attempt {}/{}): {}", method, chain, attempt + 1, rotator.getMaxAttempts(), e.getMessage());
            }
        }
        throw new RpcException(method + " on " + chain + " failed after " + rotator.getMaxAttempts() + " attempts", lastException);
    }

    private JsonNode call(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + chain);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }

    static String toHex(long block) {
        return "0x" + Long.toHexString(block);
    }
}
