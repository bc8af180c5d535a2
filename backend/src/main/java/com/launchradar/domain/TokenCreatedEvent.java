package com.launchradar.domain;

import java.util.List;

/**
 * Application event: a token was projected from its creation log. Fanned out by the API layer.
 */
public record TokenCreatedEvent(
        long chainId,
        String tokenAddress,
        String creatorAddress,
        String name,
        String symbol,
        String txHash,
        long blockNumber,
        String tokenPrice,
        String marketCap,
        String graduationProgress,
        List<HolderSnapshot> holders
) {
}
