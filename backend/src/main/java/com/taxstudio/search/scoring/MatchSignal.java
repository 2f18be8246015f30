package com.taxstudio.search.scoring;

/**
 * Raw evidence from a strategy: tier plus strength in [0, 1]. Out-of-range strengths are clamped.
 */
public record MatchSignal(SignalTier tier, double strength) {

    public MatchSignal {
        if (tier == null) {
            throw new IllegalArgumentException("tier is required");
        }
        if (Double.isNaN(strength)) {
            strength = 0.0;
        }
        strength = Math.max(0.0, Math.min(1.0, strength));
    }

    public static MatchSignal of(SignalTier tier, double strength) {
        return new MatchSignal(tier, strength);
    }
}
