package com.launchradar.pricing.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.launchradar.pricing.AlchemyUsdPriceProvider;
import com.launchradar.pricing.CoinGeckoUsdPriceProvider;
import com.launchradar.pricing.UsdPriceOracle;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Pricing module configuration: properties and the oracle with its provider order (Alchemy, then CoinGecko).
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    public UsdPriceOracle usdPriceOracle(AlchemyUsdPriceProvider alchemy,
                                         CoinGeckoUsdPriceProvider coinGecko,
                                         PricingProperties pricingProperties) {
        return new UsdPriceOracle(
                List.of(alchemy, coinGecko),
                Duration.ofMinutes(pricingProperties.getCacheTtlMinutes()),
                new BigDecimal(pricingProperties.getDefaultUsdPrice()),
                Ticker.systemTicker());
    }
}
