package com.taxstudio.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Candidate queries for precision search. Every query returns only unassociated files: owned by the
 * user, extraction complete, not soft-deleted and not yet linked to any transaction.
 */
public interface ReceiptFileRepositoryCustom {

    /**
     * Files referencing a partner: by partner id, sender domain, extracted IBAN, extracted VAT id,
     * or an extracted partner name containing one of the aliases (case-insensitive). {@code ibans} and
     * {@code vatId} are expected normalized; stored values match regardless of case and of the
     * whitespace (IBAN) or whitespace, dot and dash (VAT id) separators they were extracted with.
     */
    List<ReceiptFile> findUnassociatedForPartner(String userId, String partnerId, Collection<String> emailDomains,
                                                 Collection<String> ibans, String vatId, Collection<String> aliases,
                                                 int limit);

    /** Files whose extracted date lies in [from, to]. */
    List<ReceiptFile> findUnassociatedExtractedBetween(String userId, Instant from, Instant to, int limit);

    /**
     * Mail-derived files of the given source types created in [from, to]; when {@code senderDomains}
     * is non-empty only files sent from those domains or their subdomains are returned.
     */
    List<ReceiptFile> findUnassociatedMailFiles(String userId, Collection<FileSourceType> sourceTypes,
                                                Collection<String> senderDomains, Instant from, Instant to,
                                                int limit);

    /** Adds the transaction back-reference to the file (idempotent). */
    void linkTransaction(String fileId, String userId, String transactionId);
}
