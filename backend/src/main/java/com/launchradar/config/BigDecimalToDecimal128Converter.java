package com.launchradar.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes BigDecimal as Decimal128. Values beyond 34 significant digits are rounded first.
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    @Override
    public Decimal128 convert(BigDecimal source) {
        if (source == null) {
            return null;
        }
        BigDecimal value = source.precision() > 34 ? source.round(MathContext.DECIMAL128) : source;
        return new Decimal128(value);
    }
}
