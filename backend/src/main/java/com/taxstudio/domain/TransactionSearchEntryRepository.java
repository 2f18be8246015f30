package com.taxstudio.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for transaction_searches.
 */
public interface TransactionSearchEntryRepository extends MongoRepository<TransactionSearchEntry, String> {

    Optional<TransactionSearchEntry> findByTransactionIdAndQueueId(String transactionId, String queueId);

    List<TransactionSearchEntry> findByTransactionIdAndUserIdOrderByCreatedAtDesc(
            String transactionId, String userId, Pageable pageable);
}
