package com.taxstudio.search.scoring;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;

/**
 * Graded evidence shared by the strategies. Amounts are compared on absolute values since bank
 * transactions carry a sign and receipts do not.
 */
public final class MatchEvidence {

    private static final BigDecimal ONE_PCT = new BigDecimal("0.01");
    private static final BigDecimal FIVE_PCT = new BigDecimal("0.05");
    private static final BigDecimal TEN_PCT = new BigDecimal("0.10");
    private static final BigDecimal FIFTY_PCT = new BigDecimal("0.50");

    private MatchEvidence() {
    }

    /**
     * Relative difference |a - b| / |a|; null when either amount is missing or the transaction amount is zero.
     */
    public static BigDecimal relativeDifference(BigDecimal transactionAmount, BigDecimal fileAmount) {
        if (transactionAmount == null || fileAmount == null || transactionAmount.signum() == 0) {
            return null;
        }
        BigDecimal expected = transactionAmount.abs();
        return expected.subtract(fileAmount.abs()).abs().divide(expected, MathContext.DECIMAL64);
    }

    /** 1.0 exact, 0.95 within 1%, 0.75 within 5%, 0.5 within 10%, else 0. */
    public static double amountCloseness(BigDecimal transactionAmount, BigDecimal fileAmount) {
        BigDecimal diff = relativeDifference(transactionAmount, fileAmount);
        if (diff == null) {
            return 0.0;
        }
        if (diff.signum() == 0) {
            return 1.0;
        }
        if (diff.compareTo(ONE_PCT) <= 0) {
            return 0.95;
        }
        if (diff.compareTo(FIVE_PCT) <= 0) {
            return 0.75;
        }
        if (diff.compareTo(TEN_PCT) <= 0) {
            return 0.5;
        }
        return 0.0;
    }

    /** True when both amounts are known and differ by more than 10%. */
    public static boolean isAmountMismatch(BigDecimal transactionAmount, BigDecimal fileAmount) {
        BigDecimal diff = relativeDifference(transactionAmount, fileAmount);
        return diff != null && diff.compareTo(TEN_PCT) > 0;
    }

    /** True when both amounts are known and differ by more than 50%. */
    public static boolean isGrossAmountMismatch(BigDecimal transactionAmount, BigDecimal fileAmount) {
        BigDecimal diff = relativeDifference(transactionAmount, fileAmount);
        return diff != null && diff.compareTo(FIFTY_PCT) > 0;
    }

    /** True when the file amount is within {@code tolerancePct} percent of the transaction amount. */
    public static boolean withinTolerance(BigDecimal transactionAmount, BigDecimal fileAmount, double tolerancePct) {
        BigDecimal diff = relativeDifference(transactionAmount, fileAmount);
        return diff != null && diff.compareTo(BigDecimal.valueOf(tolerancePct / 100.0)) <= 0;
    }

    /** 1.0 same day, 0.8 within 3 days, 0.55 within 7, 0.3 within 14, 0.15 within 30, else 0. */
    public static double dateProximity(Instant transactionDate, Instant fileDate) {
        if (transactionDate == null || fileDate == null) {
            return 0.0;
        }
        long days = Math.abs(Duration.between(transactionDate, fileDate).toDays());
        if (days == 0) {
            return 1.0;
        }
        if (days <= 3) {
            return 0.8;
        }
        if (days <= 7) {
            return 0.55;
        }
        if (days <= 14) {
            return 0.3;
        }
        if (days <= 30) {
            return 0.15;
        }
        return 0.0;
    }
}
