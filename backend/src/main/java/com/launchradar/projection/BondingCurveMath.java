package com.launchradar.projection;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Price and size derivations from bonding-curve reserves. All on-chain quantities are 18-decimal base units.
 */
public final class BondingCurveMath {

    public static final int DECIMALS = 18;
    public static final String ZERO_PRICE = "0";

    static final BigInteger WAD = BigInteger.TEN.pow(DECIMALS);
    private static final BigDecimal MAX_PRICE = new BigDecimal(1000);

    private BondingCurveMath() {
    }

    /**
     * {@code quoteReserve * 1e18 / baseReserve} rendered with 18 decimals. A zero denominator, or a result outside
     * (0, 1000], yields {@link #ZERO_PRICE}.
     */
    public static String price(BigInteger quoteReserve, BigInteger baseReserve) {
        if (quoteReserve == null || baseReserve == null || baseReserve.signum() == 0) {
            return ZERO_PRICE;
        }
        BigInteger priceWei = quoteReserve.multiply(WAD).divide(baseReserve);
        BigDecimal value = new BigDecimal(priceWei, DECIMALS);
        if (value.signum() <= 0 || value.compareTo(MAX_PRICE) > 0) {
            return ZERO_PRICE;
        }
        return value.toPlainString();
    }

    public static boolean isValidPrice(String price) {
        return price != null && !price.isBlank() && new BigDecimal(price).signum() > 0;
    }

    public static BigInteger toWei(String decimal) {
        if (decimal == null || decimal.isBlank()) {
            return BigInteger.ZERO;
        }
        return new BigDecimal(decimal).movePointRight(DECIMALS).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    public static String formatUnits(BigInteger wei) {
        return new BigDecimal(wei == null ? BigInteger.ZERO : wei, DECIMALS).toPlainString();
    }

    /**
     * Market cap in wei: {@code totalSupply * priceWei / 1e18}.
     */
    public static BigInteger marketCap(BigInteger totalSupply, String price) {
        if (totalSupply == null || totalSupply.signum() <= 0 || !isValidPrice(price)) {
            return BigInteger.ZERO;
        }
        return totalSupply.multiply(toWei(price)).divide(WAD);
    }

    /**
     * {@code realQuoteReserves * 1e18 / graduationThreshold}; zero when the threshold is unknown.
     */
    public static BigInteger graduationProgress(BigInteger realQuoteReserves, BigInteger graduationThreshold) {
        if (realQuoteReserves == null || graduationThreshold == null || graduationThreshold.signum() <= 0) {
            return BigInteger.ZERO;
        }
        return realQuoteReserves.multiply(WAD).divide(graduationThreshold);
    }

    /**
     * Wei amount converted to USD at the given ETH rate.
     */
    public static BigDecimal weiToUsd(BigInteger wei, BigDecimal ethUsd) {
        if (wei == null || ethUsd == null || wei.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(wei, DECIMALS).multiply(ethUsd).setScale(DECIMALS, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    public static BigDecimal priceToUsd(String price, BigDecimal ethUsd) {
        return isValidPrice(price) ? weiToUsd(toWei(price), ethUsd) : BigDecimal.ZERO;
    }

    public static BigInteger parse(String baseUnits) {
        if (baseUnits == null || baseUnits.isBlank()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(baseUnits.strip());
    }
}
