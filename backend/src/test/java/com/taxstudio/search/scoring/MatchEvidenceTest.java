package com.taxstudio.search.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MatchEvidenceTest {

    private static final BigDecimal HUNDRED = new BigDecimal("100.00");
    private static final Instant TX_DATE = Instant.parse("2025-03-10T12:00:00Z");

    @Test
    @DisplayName("amount closeness compares absolute values in graded bands")
    void amountCloseness() {
        assertThat(MatchEvidence.amountCloseness(new BigDecimal("-100.00"), HUNDRED)).isEqualTo(1.0);
        assertThat(MatchEvidence.amountCloseness(HUNDRED, new BigDecimal("100.50"))).isEqualTo(0.95);
        assertThat(MatchEvidence.amountCloseness(HUNDRED, new BigDecimal("104"))).isEqualTo(0.75);
        assertThat(MatchEvidence.amountCloseness(HUNDRED, new BigDecimal("92"))).isEqualTo(0.5);
        assertThat(MatchEvidence.amountCloseness(HUNDRED, new BigDecimal("120"))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("missing or zero amounts carry no evidence")
    void amountClosenessMissing() {
        assertThat(MatchEvidence.amountCloseness(null, HUNDRED)).isEqualTo(0.0);
        assertThat(MatchEvidence.amountCloseness(HUNDRED, null)).isEqualTo(0.0);
        assertThat(MatchEvidence.amountCloseness(BigDecimal.ZERO, HUNDRED)).isEqualTo(0.0);
        assertThat(MatchEvidence.isAmountMismatch(HUNDRED, null)).isFalse();
    }

    @Test
    void mismatchFlags() {
        assertThat(MatchEvidence.isAmountMismatch(HUNDRED, new BigDecimal("110"))).isFalse();
        assertThat(MatchEvidence.isAmountMismatch(HUNDRED, new BigDecimal("111"))).isTrue();
        assertThat(MatchEvidence.isGrossAmountMismatch(HUNDRED, new BigDecimal("140"))).isFalse();
        assertThat(MatchEvidence.isGrossAmountMismatch(HUNDRED, new BigDecimal("151"))).isTrue();
    }

    @Test
    void withinTolerance() {
        assertThat(MatchEvidence.withinTolerance(new BigDecimal("-100"), new BigDecimal("105"), 5.0)).isTrue();
        assertThat(MatchEvidence.withinTolerance(HUNDRED, new BigDecimal("105.01"), 5.0)).isFalse();
        assertThat(MatchEvidence.withinTolerance(HUNDRED, null, 5.0)).isFalse();
    }

    @Test
    @DisplayName("date proximity decays with day distance in either direction")
    void dateProximity() {
        assertThat(MatchEvidence.dateProximity(TX_DATE, TX_DATE.plus(Duration.ofHours(5)))).isEqualTo(1.0);
        assertThat(MatchEvidence.dateProximity(TX_DATE, TX_DATE.minus(Duration.ofDays(2)))).isEqualTo(0.8);
        assertThat(MatchEvidence.dateProximity(TX_DATE, TX_DATE.plus(Duration.ofDays(5)))).isEqualTo(0.55);
        assertThat(MatchEvidence.dateProximity(TX_DATE, TX_DATE.minus(Duration.ofDays(10)))).isEqualTo(0.3);
        assertThat(MatchEvidence.dateProximity(TX_DATE, TX_DATE.plus(Duration.ofDays(20)))).isEqualTo(0.15);
        assertThat(MatchEvidence.dateProximity(TX_DATE, TX_DATE.plus(Duration.ofDays(40)))).isEqualTo(0.0);
        assertThat(MatchEvidence.dateProximity(null, TX_DATE)).isEqualTo(0.0);
    }
}
