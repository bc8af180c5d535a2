package com.launchradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported EVM chains with their numeric chain id. Documents store {@link #id()}.
 */
public enum ChainId {
    ETHEREUM(1L),
    BASE(8453L),
    ARBITRUM(42161L),
    BASE_SEPOLIA(84532L);

    private final long id;

    ChainId(long id) {
        this.id = id;
    }

    public long id() {
        return id;
    }

    public static Optional<ChainId> fromId(long id) {
        return Arrays.stream(values()).filter(c -> c.id == id).findFirst();
    }
}
