package com.taxstudio.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional updates for transactions.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRepositoryImpl implements TransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean attachFile(String transactionId, String userId, String fileId, MatchProvenance provenance) {
        Query query = new Query(where("id").is(transactionId)
                .and("userId").is(userId)
                .and("fileIds").ne(fileId)
                .and("rejectedFileIds").ne(fileId));
        Update update = new Update()
                .push("fileIds", fileId)
                .set("complete", true)
                .set("matchProvenance", provenance)
                .set("updatedAt", Instant.now());
        UpdateResult result = mongoTemplate.updateFirst(query, update, Transaction.class);
        return result.getModifiedCount() > 0;
    }
}
