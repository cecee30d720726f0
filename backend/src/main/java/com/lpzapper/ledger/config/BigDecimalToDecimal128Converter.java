package com.lpzapper.ledger.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes BigDecimal to MongoDB as Decimal128, rounded to its 34-digit precision.
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    @Override
    public Decimal128 convert(BigDecimal source) {
        return new Decimal128(source.round(MathContext.DECIMAL128));
    }
}
