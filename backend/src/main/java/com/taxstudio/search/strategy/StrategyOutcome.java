package com.taxstudio.search.strategy;

import com.taxstudio.search.scoring.MatchCandidate;

import java.util.List;

/**
 * Candidates found by one strategy for one transaction, or the non-fatal error that stopped it.
 */
public record StrategyOutcome(List<MatchCandidate> candidates, String error) {

    public StrategyOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static StrategyOutcome empty() {
        return new StrategyOutcome(List.of(), null);
    }

    public static StrategyOutcome of(List<MatchCandidate> candidates) {
        return new StrategyOutcome(candidates, null);
    }

    public static StrategyOutcome failed(String error) {
        return new StrategyOutcome(List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }
}
