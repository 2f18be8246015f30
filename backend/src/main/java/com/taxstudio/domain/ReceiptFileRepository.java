package com.taxstudio.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for receipt files. Candidate queries live in {@link ReceiptFileRepositoryCustom}.
 */
public interface ReceiptFileRepository extends MongoRepository<ReceiptFile, String>, ReceiptFileRepositoryCustom {
}
