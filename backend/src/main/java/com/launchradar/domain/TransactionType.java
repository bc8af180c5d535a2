package com.launchradar.domain;

/**
 * Trade record type.
 */
public enum TransactionType {
    BOUGHT,
    SOLD,
    ADD_LIQUIDITY,
    REMOVE_LIQUIDITY,
    TRANSFER,
    MINT,
    BURN
}
