package com.taxstudio.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigDecimal;

/**
 * Reads Decimal128 amounts back as BigDecimal. NaN and infinite values, which extraction can leave on
 * unreadable receipts, read as null so the file is treated as having no amount.
 */
@ReadingConverter
public class Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {

    @Override
    public BigDecimal convert(Decimal128 source) {
        if (source == null || source.isNaN() || source.isInfinite()) {
            return null;
        }
        return source.bigDecimalValue();
    }
}
