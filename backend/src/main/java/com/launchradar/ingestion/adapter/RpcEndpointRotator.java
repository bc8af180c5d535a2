package com.launchradar.ingestion.adapter;

import com.launchradar.common.BackoffPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin selection over one chain's RPC endpoints, plus the retry delay between attempts.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final BackoffPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, BackoffPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : BackoffPolicy.rpcRetry();
    }

    public String getNextEndpoint() {
        int i = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return Math.max(1, retryPolicy.getMaxAttempts());
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
