package com.launchradar.ingestion.adapter;

/**
 * Thrown when a chain RPC call fails (HTTP, JSON-RPC error or unparseable result).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
