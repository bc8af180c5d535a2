package com.launchradar.ingestion.adapter;

import com.launchradar.common.BackoffPolicy;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.config.ConnectionProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every per-chain connection resource of this runtime: cached read clients, the live socket cache and the
 * socket-creation rate-limit table. Each map is keyed by chain and only touched by that chain's own callers.
 */
@Slf4j
@Component
public class ChainConnectionManager {

    private final ChainRegistry chainRegistry;
    private final ChainReadClientFactory readClientFactory;
    private final SocketConnector socketConnector;
    private final ConnectionBackoffTable backoffTable;
    private final Map<ChainId, ChainReadClient> providers = new ConcurrentHashMap<>();
    private final Map<ChainId, SocketConnection> sockets = new ConcurrentHashMap<>();

    @Autowired
    public ChainConnectionManager(ChainRegistry chainRegistry,
                                  ChainReadClientFactory readClientFactory,
                                  SocketConnector socketConnector,
                                  ConnectionProperties connectionProperties,
                                  Clock clock) {
        this(chainRegistry, readClientFactory, socketConnector, new ConnectionBackoffTable(
                new BackoffPolicy(
                        connectionProperties.getRateLimitBaseDelayMs(),
                        connectionProperties.getRateLimitMaxDelayMs(),
                        connectionProperties.getRateLimitMaxExponent(),
                        0,
                        Integer.MAX_VALUE),
                clock));
    }

    ChainConnectionManager(ChainRegistry chainRegistry,
                           ChainReadClientFactory readClientFactory,
                           SocketConnector socketConnector,
                           ConnectionBackoffTable backoffTable) {
        this.chainRegistry = chainRegistry;
        this.readClientFactory = readClientFactory;
        this.socketConnector = socketConnector;
        this.backoffTable = backoffTable;
    }

    /**
     * Read client bound to the chain's RPC endpoints and contract.
     *
     * @throws ChainConfigurationException when the chain is not configured
     */
    public ChainReadClient getProvider(ChainId chain) {
        if (!chainRegistry.isConfigured(chain)) {
            throw new ChainConfigurationException("Chain " + chain + " is not configured");
        }
        return providers.computeIfAbsent(chain, readClientFactory::create);
    }

    /**
     * Cached open socket for the chain, or a new one. Returns {@code null} while the chain is cooling down after a
     * rate-limit signal; callers skip the chain for now.
     *
     * @throws ChainConfigurationException when the chain has no socket URL
     * @throws SocketConnectionException   when the connection cannot be created
     */
    public SocketConnection getSocketConnection(ChainId chain) {
        String wsUrl = chainRegistry.wsUrl(chain)
                .orElseThrow(() -> new ChainConfigurationException("Chain " + chain + " has no ws-url"));
        SocketConnection cached = sockets.get(chain);
        if (cached != null) {
            if (cached.state() == SocketState.OPEN) {
                return cached;
            }
            evict(chain, cached);
        }
        if (backoffTable.isBackingOff(chain)) {
            log.debug("Socket creation for {} skipped: rate-limit cool-down until {}", chain,
                    backoffTable.backoffUntil(chain).orElse(null));
            return null;
        }
        SocketConnection connection;
        try {
            connection = socketConnector.connect(chain, URI.create(wsUrl));
        } catch (SocketConnectionException e) {
            if (e.isRateLimited()) {
                applyRateLimitBackoff(chain);
            }
            throw e;
        }
        connection.addCloseListener((code, reason, error) -> onSocketClosed(chain, connection, code, reason, error));
        sockets.put(chain, connection);
        backoffTable.reset(chain);
        log.info("Socket connection for {} open", chain);
        return connection;
    }

    public boolean isBackingOff(ChainId chain) {
        return backoffTable.isBackingOff(chain);
    }

    ConnectionBackoffTable backoffTable() {
        return backoffTable;
    }

    /**
     * Closes every cached socket with a normal closure code.
     */
    @PreDestroy
    public void closeAll() {
        sockets.forEach((chain, connection) -> {
            sockets.remove(chain, connection);
            closeQuietly(chain, connection, SocketConnection.NORMAL_CLOSURE, "shutdown");
        });
    }

    private void onSocketClosed(ChainId chain, SocketConnection connection, int code, String reason, Throwable error) {
        sockets.remove(chain, connection);
        boolean rateLimited = (error != null && RpcErrors.isRateLimited(error)) || RpcErrors.isRateLimited(reason);
        if (rateLimited) {
            applyRateLimitBackoff(chain);
        } else {
            log.debug("Socket for {} closed (code {}), evicted", chain, code);
        }
    }

    private void applyRateLimitBackoff(ChainId chain) {
        Instant until = backoffTable.recordRateLimit(chain);
        log.warn("Socket provider for {} rate-limited; no new connection before {} (attempt {})",
                chain, until, backoffTable.attempts(chain));
    }

    private void evict(ChainId chain, SocketConnection connection) {
        sockets.remove(chain, connection);
        SocketState state = connection.state();
        // Closing a connecting or closed socket makes the client library throw.
        if (state == SocketState.OPEN || state == SocketState.CLOSING) {
            closeQuietly(chain, connection, SocketConnection.NORMAL_CLOSURE, "evicted");
        }
    }

    private void closeQuietly(ChainId chain, SocketConnection connection, int code, String reason) {
        try {
            connection.close(code, reason);
        } catch (RuntimeException e) {
            log.warn("Closing socket for {} failed: {}", chain, e.getMessage());
        }
    }
}
