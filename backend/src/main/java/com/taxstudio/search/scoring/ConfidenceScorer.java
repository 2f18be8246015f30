package com.taxstudio.search.scoring;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Maps heterogeneous match signals onto one comparable confidence and orders candidates deterministically.
 * <p>
 * confidence = tier.floor + (tier.ceiling - tier.floor) * strength, rounded half-up to 4 decimals.
 * Candidates below {@link #ACCEPTANCE_THRESHOLD} are never attached. Ties are broken by file createdAt
 * (newest first, missing last), then by file id ascending.
 */
@Component
public class ConfidenceScorer {

    public static final BigDecimal ACCEPTANCE_THRESHOLD = new BigDecimal("0.60");
    private static final int SCALE = 4;

    static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparing(ScoredCandidate::confidence, Comparator.reverseOrder())
            .thenComparing(sc -> sc.candidate().file().getCreatedAt(),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(ScoredCandidate::fileId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    public BigDecimal score(MatchSignal signal) {
        BigDecimal span = signal.tier().ceiling().subtract(signal.tier().floor());
        BigDecimal confidence = signal.tier().floor().add(span.multiply(BigDecimal.valueOf(signal.strength())));
        return confidence.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public boolean isAccepted(BigDecimal confidence) {
        return confidence != null && confidence.compareTo(ACCEPTANCE_THRESHOLD) >= 0;
    }

    /** All candidates scored and sorted best first; rejected ones included. */
    public List<ScoredCandidate> rank(List<MatchCandidate> candidates) {
        return candidates.stream()
                .map(c -> new ScoredCandidate(c, score(c.signal())))
                .sorted(RANKING)
                .toList();
    }

    /** Best candidate at or above the acceptance threshold. */
    public Optional<ScoredCandidate> best(List<ScoredCandidate> ranked) {
        return ranked.stream().filter(sc -> isAccepted(sc.confidence())).findFirst();
    }
}
