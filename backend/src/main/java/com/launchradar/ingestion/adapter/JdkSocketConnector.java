package com.launchradar.ingestion.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.config.ConnectionProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens {@link JdkSocketConnection}s with the shared JDK HTTP client.
 */
@Component
public class JdkSocketConnector implements SocketConnector {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ConnectionProperties connectionProperties;

    public JdkSocketConnector(@Qualifier("socketHttpClient") HttpClient httpClient,
                              ObjectMapper objectMapper,
                              ConnectionProperties connectionProperties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.connectionProperties = connectionProperties;
    }

    @Override
    public SocketConnection connect(ChainId chain, URI uri) {
        JdkSocketConnection connection = new JdkSocketConnection(chain, objectMapper);
        try {
            httpClient.newWebSocketBuilder()
                    .buildAsync(uri, connection)
                    .get(connectionProperties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
            return connection;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SocketConnectionException("Socket handshake to " + chain + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new SocketConnectionException("Socket handshake to " + chain + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SocketConnectionException("Interrupted while connecting to " + chain, e);
        }
    }
}
