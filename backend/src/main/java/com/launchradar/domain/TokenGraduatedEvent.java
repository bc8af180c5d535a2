package com.launchradar.domain;

/**
 * Application event: the curve graduated the token to a liquidity pool.
 */
public record TokenGraduatedEvent(long chainId, String tokenAddress, String txHash, long blockNumber, String graduationPrice) {
}
