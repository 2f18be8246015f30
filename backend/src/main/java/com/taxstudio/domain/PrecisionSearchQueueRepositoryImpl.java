package com.taxstudio.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed atomic transitions for precision_search_queue. Both transitions bump
 * {@code version} so a worker still holding the previous copy fails its next save.
 */
@Repository
@RequiredArgsConstructor
public class PrecisionSearchQueueRepositoryImpl implements PrecisionSearchQueueRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<PrecisionSearchQueueItem> claim(String queueId, String workerId, Instant leaseExpiresAt) {
        Instant now = Instant.now();
        Query query = new Query(where("id").is(queueId).and("status").is(SearchStatus.PENDING));
        Update update = new Update()
                .set("status", SearchStatus.PROCESSING)
                .set("workerId", workerId)
                .set("leaseExpiresAt", leaseExpiresAt)
                .set("startedAt", now)
                .set("updatedAt", now)
                .inc("version", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), PrecisionSearchQueueItem.class));
    }

    @Override
    public Optional<PrecisionSearchQueueItem> reclaimStale(String queueId, String workerId, Instant now,
                                                           Instant leaseExpiresAt) {
        Query query = new Query(where("id").is(queueId)
                .and("status").is(SearchStatus.PROCESSING)
                .and("leaseExpiresAt").lt(now));
        Update update = new Update()
                .set("workerId", workerId)
                .set("leaseExpiresAt", leaseExpiresAt)
                .set("updatedAt", now)
                .inc("version", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), PrecisionSearchQueueItem.class));
    }

    @Override
    public void clearRetryMarker(String queueId) {
        Query query = new Query(where("id").is(queueId).and("status").is(SearchStatus.FAILED));
        mongoTemplate.updateFirst(query, new Update().unset("nextRetryAfter").set("updatedAt", Instant.now()),
                PrecisionSearchQueueItem.class);
    }

    @Override
    public List<String> findStaleProcessingIds(Instant now, int limit) {
        Query query = new Query(where("status").is(SearchStatus.PROCESSING).and("leaseExpiresAt").lt(now))
                .with(Sort.by(Sort.Direction.ASC, "leaseExpiresAt"))
                .limit(limit);
        query.fields().include("id");
        return mongoTemplate.find(query, PrecisionSearchQueueItem.class).stream()
                .map(PrecisionSearchQueueItem::getId)
                .toList();
    }
}
