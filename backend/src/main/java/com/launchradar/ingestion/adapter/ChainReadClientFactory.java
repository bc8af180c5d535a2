package com.launchradar.ingestion.adapter;

import com.launchradar.domain.ChainId;

/**
 * Creates the read client for a configured chain.
 */
@FunctionalInterface
public interface ChainReadClientFactory {

    ChainReadClient create(ChainId chain);
}
