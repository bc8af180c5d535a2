package com.launchradar.ingestion.adapter;

import com.launchradar.domain.ChainId;

import java.net.URI;

/**
 * Opens socket connections. Blocks until the connection is open or fails.
 */
@FunctionalInterface
public interface SocketConnector {

    /**
     * @throws SocketConnectionException when the handshake fails; {@link SocketConnectionException#isRateLimited()}
     *                                   tells whether the provider signalled rate limiting
     */
    SocketConnection connect(ChainId chain, URI uri);
}
