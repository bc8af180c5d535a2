package com.launchradar.domain;

/**
 * Application event: real quote reserves reached the graduation threshold while the token is still on the curve.
 * Consumed by whichever operator component submits the graduation transaction.
 */
public record GraduationThresholdReachedEvent(long chainId, String tokenAddress, String realQuoteReserves, String graduationThreshold) {
}
