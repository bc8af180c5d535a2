package com.launchradar.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * ETH/USD via CoinGecko /simple/price.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoUsdPriceProvider implements UsdPriceProvider {

    private static final String COIN_ID = "ethereum";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;

    @Override
    public String name() {
        return "coingecko";
    }

    @Override
    public Optional<BigDecimal> fetchEthUsd() {
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids=" + COIN_ID + "&vs_currencies=usd";
        try {
            String response = webClientBuilder.build().get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(pricingProperties.getRequestTimeoutSeconds()))
                    .block();
            return parseUsdPrice(response);
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko ETH price failed: {}", e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("CoinGecko ETH price error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<BigDecimal> parseUsdPrice(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode usd = MAPPER.readTree(json).path(COIN_ID).path("usd");
            if (!usd.isNumber()) {
                return Optional.empty();
            }
            BigDecimal value = usd.decimalValue();
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
