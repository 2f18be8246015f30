package com.taxstudio.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Decimal128 mapping for {@code transactions.amount}, {@code files.extractedAmount} and the match
 * confidence in {@code matchProvenance}. Queue, file and transaction indexes (including the unique
 * in-flight key) come from the document annotations via {@code auto-index-creation}.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()));
    }
}
