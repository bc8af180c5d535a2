package com.launchradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Read-model storage. Prices in wei, balances and supplies stay base-unit strings so no precision is lost; only the
 * USD side of tokens, transactions and histories is numeric and goes through the Decimal128 converters. The unique
 * indexes that make replayed events harmless are declared on the documents and created at startup
 * (spring.data.mongodb.auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions launchRadarConversions() {
        return new MongoCustomConversions(List.of(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()));
    }
}
