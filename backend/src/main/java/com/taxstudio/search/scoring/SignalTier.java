package com.taxstudio.search.scoring;

import java.math.BigDecimal;

/**
 * Evidence tiers with the confidence band each maps into. A signal's strength interpolates between
 * floor and ceiling, so tiers only overlap where weak strong-tier evidence meets strong weak-tier evidence.
 */
public enum SignalTier {
    IBAN_VAT_EXACT("0.90", "1.00"),
    AMOUNT_DATE("0.40", "0.90"),
    DOMAIN_ALIAS("0.35", "0.80"),
    AI_QUERY_HIT("0.20", "0.70");

    private final BigDecimal floor;
    private final BigDecimal ceiling;

    SignalTier(String floor, String ceiling) {
        this.floor = new BigDecimal(floor);
        this.ceiling = new BigDecimal(ceiling);
    }

    public BigDecimal floor() {
        return floor;
    }

    public BigDecimal ceiling() {
        return ceiling;
    }
}
