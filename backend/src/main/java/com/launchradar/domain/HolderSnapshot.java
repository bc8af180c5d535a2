package com.launchradar.domain;

import java.math.BigDecimal;

/**
 * One holder row as carried in broadcast payloads.
 */
public record HolderSnapshot(String holderAddress, String balance, BigDecimal balanceUsd, double percentage) {
}
