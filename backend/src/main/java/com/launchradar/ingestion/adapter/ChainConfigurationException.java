package com.launchradar.ingestion.adapter;

/**
 * A chain is missing RPC URL, socket URL or contract address for the requested operation.
 */
public class ChainConfigurationException extends IllegalStateException {

    public ChainConfigurationException(String message) {
        super(message);
    }
}
