package com.launchradar.ingestion.adapter;

import java.net.http.WebSocketHandshakeException;
import java.util.Locale;

/**
 * Classifies provider errors by message. Providers report rate limiting inconsistently (HTTP 429, JSON-RPC
 * -32005, free-text), so the cause chain is searched.
 */
public final class RpcErrors {

    private RpcErrors() {
    }

    public static boolean isRateLimited(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 8) {
            if (current instanceof WebSocketHandshakeException handshake
                    && handshake.getResponse() != null
                    && handshake.getResponse().statusCode() == 429) {
                return true;
            }
            if (isRateLimited(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isRateLimited(String message) {
        if (message == null) {
            return false;
        }
        String msg = message.toLowerCase(Locale.ROOT);
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("request limit") || msg.contains("-32005");
    }

    public static boolean isRangeTooWide(Throwable error) {
        if (error == null || error.getMessage() == null) {
            return false;
        }
        String msg = error.getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("-32701") || msg.contains("query returned more than")
                || msg.contains("too many results") || msg.contains("block range is too wide")
                || msg.contains("exceed maximum block range") || msg.contains("log response size exceeded");
    }
}
