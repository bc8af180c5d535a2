package com.launchradar.ingestion.adapter;

/**
 * Lifecycle of a socket connection, mirroring the WebSocket ready states.
 */
public enum SocketState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
