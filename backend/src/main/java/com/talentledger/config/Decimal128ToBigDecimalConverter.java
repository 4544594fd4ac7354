package com.talentledger.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigDecimal;

/**
 * Reads stored wei amounts back as BigDecimal; NaN and infinities never occur in a valid ledger amount.
 */
@ReadingConverter
public class Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {

    @Override
    public BigDecimal convert(Decimal128 amount) {
        if (amount.isNaN() || amount.isInfinite()) {
            throw new IllegalStateException("Stored amount is not a finite decimal: " + amount);
        }
        return amount.bigDecimalValue();
    }
}
