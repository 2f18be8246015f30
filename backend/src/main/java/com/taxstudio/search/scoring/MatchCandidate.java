package com.taxstudio.search.scoring;

import com.taxstudio.domain.ReceiptFile;

import java.util.List;

/**
 * A file proposed by a strategy for one transaction, with the evidence behind it.
 */
public record MatchCandidate(ReceiptFile file, MatchSignal signal, List<String> reasons) {

    public MatchCandidate {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public String fileId() {
        return file.getId();
    }
}
