package com.launchradar.pricing;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One upstream source of the ETH price in USD. Implementations report failures as empty.
 */
public interface UsdPriceProvider {

    String name();

    Optional<BigDecimal> fetchEthUsd();
}
