package com.launchradar.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * ETH/USD via the Alchemy prices API ({@code /tokens/by-symbol?symbols=ETH}). Disabled without an API key.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlchemyUsdPriceProvider implements UsdPriceProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;

    @Override
    public String name() {
        return "alchemy";
    }

    @Override
    public Optional<BigDecimal> fetchEthUsd() {
        String apiKey = pricingProperties.getAlchemyApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Alchemy API key not set, skipping");
            return Optional.empty();
        }
        String url = pricingProperties.getAlchemyBaseUrl() + "/tokens/by-symbol?symbols=ETH";
        try {
            String response = webClientBuilder.build().get()
                    .uri(url)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(pricingProperties.getRequestTimeoutSeconds()))
                    .block();
            return parseUsdPrice(response);
        } catch (WebClientResponseException e) {
            log.warn("Alchemy ETH price failed: {}", e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Alchemy ETH price error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads {@code data[0].prices[currency == usd].value}; the value is a decimal string.
     */
    static Optional<BigDecimal> parseUsdPrice(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode prices = MAPPER.readTree(json).path("data").path(0).path("prices");
            if (!prices.isArray()) {
                return Optional.empty();
            }
            for (JsonNode price : prices) {
                if ("usd".equalsIgnoreCase(price.path("currency").asText())) {
                    BigDecimal value = new BigDecimal(price.path("value").asText());
                    return value.signum() > 0 ? Optional.of(value) : Optional.empty();
                }
            }
            return Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
