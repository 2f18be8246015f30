package com.taxstudio.search.match;

import com.taxstudio.domain.MatchProvenance;
import com.taxstudio.domain.ReceiptFileRepository;
import com.taxstudio.domain.Transaction;
import com.taxstudio.domain.TransactionRepository;
import com.taxstudio.search.scoring.ScoredCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Writes an accepted match: file id onto the transaction (conditional, so a replay is a no-op), then the
 * transaction id onto the file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionMatchWriter {

    private final TransactionRepository transactionRepository;
    private final ReceiptFileRepository receiptFileRepository;

    /**
     * @return true when the file was attached by this call; false when it was already attached, rejected by
     * the user, or the transaction no longer exists
     */
    public boolean attach(Transaction transaction, ScoredCandidate winner, String strategyId, String queueId) {
        MatchProvenance provenance = new MatchProvenance(MatchProvenance.MatchedBy.AUTOMATION, strategyId,
                winner.confidence(), winner.fileId(), queueId, Instant.now());
        boolean attached = transactionRepository.attachFile(
                transaction.getId(), transaction.getUserId(), winner.fileId(), provenance);
        if (!attached) {
            log.debug("File {} not attached to transaction {} (already present or rejected)",
                    winner.fileId(), transaction.getId());
            return false;
        }
        receiptFileRepository.linkTransaction(winner.fileId(), transaction.getUserId(), transaction.getId());
        log.debug("Attached file {} to transaction {} via {} (confidence {})",
                winner.fileId(), transaction.getId(), strategyId, winner.confidence());
        return true;
    }

    /** Re-applies the file back-reference of a match written by an earlier, interrupted run. */
    public void ensureFileLinked(Transaction transaction) {
        MatchProvenance provenance = transaction.getMatchProvenance();
        if (provenance != null && provenance.fileId() != null) {
            receiptFileRepository.linkTransaction(provenance.fileId(), transaction.getUserId(), transaction.getId());
        }
    }
}
