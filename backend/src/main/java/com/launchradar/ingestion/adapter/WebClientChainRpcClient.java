package com.launchradar.ingestion.adapter;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC client on WebClient.
 */
public class WebClientChainRpcClient implements ChainRpcClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientChainRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(method + " failed: " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(method + " request failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new RpcException(method + " timed out after " + timeout.toMillis() + " ms", e));
    }
}
