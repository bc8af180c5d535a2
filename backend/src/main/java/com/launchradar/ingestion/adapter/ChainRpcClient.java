package com.launchradar.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * Ethereum JSON-RPC over HTTP. Retries and endpoint rotation are the caller's concern.
 */
public interface ChainRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      positional params
     * @return response body (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
