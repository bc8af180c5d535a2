package com.launchradar.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Application event: a new price snapshot was stored for a token.
 */
public record TokenPriceUpdatedEvent(
        long chainId,
        String tokenAddress,
        String tokenPrice,
        BigDecimal priceUsd,
        String marketCap,
        BigDecimal marketCapUsd,
        long blockNumber,
        Instant timestamp
) {
}
