package com.launchradar.projection;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Share of total supply held, in percent with four decimals, clamped to [0, 100].
 */
public final class HolderPercentageCalculator {

    private static final int SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private HolderPercentageCalculator() {
    }

    public static double percentage(BigInteger balance, BigInteger totalSupply) {
        if (balance == null || totalSupply == null || balance.signum() <= 0 || totalSupply.signum() <= 0) {
            return 0d;
        }
        BigDecimal pct = new BigDecimal(balance).multiply(HUNDRED)
                .divide(new BigDecimal(totalSupply), SCALE, RoundingMode.HALF_UP);
        return pct.min(HUNDRED).doubleValue();
    }
}
