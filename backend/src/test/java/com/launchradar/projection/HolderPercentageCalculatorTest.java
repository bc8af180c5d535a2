package com.launchradar.projection;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HolderPercentageCalculatorTest {

    private static final BigInteger SUPPLY = BigInteger.valueOf(1_000_000);

    @Test
    void percentage_fourDecimals() {
        assertThat(HolderPercentageCalculator.percentage(SUPPLY, SUPPLY)).isEqualTo(100.0);
        assertThat(HolderPercentageCalculator.percentage(BigInteger.valueOf(250_000), SUPPLY)).isEqualTo(25.0);
        assertThat(HolderPercentageCalculator.percentage(BigInteger.ONE, BigInteger.valueOf(3))).isEqualTo(33.3333);
    }

    @Test
    void percentage_clampedAndZeroSafe() {
        assertThat(HolderPercentageCalculator.percentage(SUPPLY.multiply(BigInteger.TWO), SUPPLY)).isEqualTo(100.0);
        assertThat(HolderPercentageCalculator.percentage(BigInteger.ZERO, SUPPLY)).isZero();
        assertThat(HolderPercentageCalculator.percentage(BigInteger.TEN, BigInteger.ZERO)).isZero();
        assertThat(HolderPercentageCalculator.percentage(BigInteger.valueOf(-5), SUPPLY)).isZero();
    }
}
