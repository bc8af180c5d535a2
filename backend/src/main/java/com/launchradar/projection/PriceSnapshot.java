package com.launchradar.projection;

import java.time.Instant;

/**
 * Curve price observed at a block; {@code tokenPrice} is an 18-decimal string or "0" when rejected.
 */
public record PriceSnapshot(String tokenAddress, String tokenPrice, long blockNumber, Instant timestamp) {
}
