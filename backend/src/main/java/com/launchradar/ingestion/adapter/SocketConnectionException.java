package com.launchradar.ingestion.adapter;

/**
 * Socket connection could not be created.
 */
public class SocketConnectionException extends RuntimeException {

    private final boolean rateLimited;

    public SocketConnectionException(String message, Throwable cause) {
        super(message, cause);
        this.rateLimited = RpcErrors.isRateLimited(cause) || RpcErrors.isRateLimited(message);
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
