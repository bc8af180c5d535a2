package com.launchradar.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * USD/ETH oracle configuration. Documented in application.yml under launchradar.pricing.
 */
@ConfigurationProperties(prefix = "launchradar.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * Alchemy prices API base URL. Queried first when an API key is set.
     */
    private String alchemyBaseUrl = "https://api.g.alchemy.com/prices/v1";

    private String alchemyApiKey;

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3). Fallback provider.
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /** How long a fetched rate is served without asking the providers again. */
    private int cacheTtlMinutes = 5;

    private int requestTimeoutSeconds = 5;

    /** Returned only when no provider has ever answered. */
    private String defaultUsdPrice = "3000";
}
