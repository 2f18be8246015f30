package com.taxstudio.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for transactions. Attaching matches goes through {@link TransactionRepositoryCustom}.
 */
public interface TransactionRepository extends MongoRepository<Transaction, String>, TransactionRepositoryCustom {

    long countByUserIdAndCompleteFalse(String userId);

    /** Incomplete transactions newest first; page size bounds the scope snapshot of a search. */
    List<Transaction> findByUserIdAndCompleteFalseOrderByDateDesc(String userId, Pageable pageable);

    Optional<Transaction> findByIdAndUserId(String id, String userId);
}
