package com.taxstudio.domain;

/**
 * Conditional updates on transactions.
 */
public interface TransactionRepositoryCustom {

    /**
     * Appends {@code fileId} to the transaction's files, marks it complete and records provenance.
     * No-op (returns false) if the transaction does not exist for the user, already holds the file,
     * or rejected it.
     */
    boolean attachFile(String transactionId, String userId, String fileId, MatchProvenance provenance);
}
