package com.launchradar.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigDecimal;

/**
 * Reads token USD prices, market caps and ETH/USD rates back with the scale they were stored with. The read model
 * never stores NaN or negative zero.
 */
@ReadingConverter
public class Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {

    @Override
    public BigDecimal convert(Decimal128 usdAmount) {
        return usdAmount == null ? null : usdAmount.bigDecimalValue();
    }
}
