package com.launchradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.common.BackoffPolicy;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.adapter.ChainReadClientFactory;
import com.launchradar.ingestion.adapter.ChainRegistry;
import com.launchradar.ingestion.adapter.ChainRpcClient;
import com.launchradar.ingestion.adapter.JsonRpcChainReadClient;
import com.launchradar.ingestion.adapter.RpcEndpointRotator;
import com.launchradar.ingestion.adapter.WebClientChainRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Wires the chain RPC layer: WebClient JSON-RPC client, shared resilience4j limiter, per-chain read clients
 * with endpoint rotation, and the JDK HTTP client used for sockets.
 */
@Configuration
@EnableConfigurationProperties({ IngestionChainProperties.class, IngestionRpcProperties.class, ConnectionProperties.class, ListenerProperties.class, BackfillProperties.class })
public class IngestionConfig {

    @Bean
    public ChainRpcClient chainRpcClient(WebClient.Builder webClientBuilder, IngestionRpcProperties rpcProperties) {
        return new WebClientChainRpcClient(webClientBuilder, Duration.ofMillis(rpcProperties.getRequestTimeoutMs()));
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(IngestionRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }

    /** Builds a read client bound to one configured chain; the Connection Manager caches the result. */
    @Bean
    public ChainReadClientFactory chainReadClientFactory(ChainRegistry chainRegistry,
                                                         ChainRpcClient chainRpcClient,
                                                         @Qualifier("chainRpcRateLimiter") RateLimiter rateLimiter,
                                                         IngestionRpcProperties rpcProperties,
                                                         ObjectMapper objectMapper) {
        return (ChainId chain) -> {
            BackoffPolicy retry = new BackoffPolicy(
                    rpcProperties.getRetryBaseDelayMs(),
                    Math.max(rpcProperties.getRetryBaseDelayMs(), 30_000L),
                    20,
                    rpcProperties.getRetryJitterFactor(),
                    rpcProperties.getRetryMaxAttempts());
            RpcEndpointRotator rotator = new RpcEndpointRotator(chainRegistry.rpcUrls(chain), retry);
            return new JsonRpcChainReadClient(chain, chainRegistry.contractAddress(chain), chainRpcClient, rotator,
                    rateLimiter, objectMapper);
        };
    }

    @Bean(name = "socketHttpClient")
    public HttpClient socketHttpClient(ConnectionProperties connectionProperties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectionProperties.getConnectTimeoutMs()))
                .build();
    }
}
