package com.taxstudio.search.scoring;

import java.math.BigDecimal;

public record ScoredCandidate(MatchCandidate candidate, BigDecimal confidence) {

    public String fileId() {
        return candidate.fileId();
    }
}
