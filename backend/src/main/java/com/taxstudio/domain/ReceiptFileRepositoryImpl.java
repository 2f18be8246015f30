package com.taxstudio.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed candidate queries for files.
 */
@Repository
@RequiredArgsConstructor
public class ReceiptFileRepositoryImpl implements ReceiptFileRepositoryCustom {

    private static final String IBAN_SEPARATORS = "\\s";
    private static final String VAT_SEPARATORS = "[\\s.-]";

    private final MongoTemplate mongoTemplate;

    @Override
    public List<ReceiptFile> findUnassociatedForPartner(String userId, String partnerId, Collection<String> emailDomains,
                                                        Collection<String> ibans, String vatId,
                                                        Collection<String> aliases, int limit) {
        List<Criteria> references = new ArrayList<>();
        if (partnerId != null) {
            references.add(where("partnerId").is(partnerId));
        }
        if (emailDomains != null && !emailDomains.isEmpty()) {
            references.add(where("senderDomain").in(emailDomains));
        }
        if (ibans != null) {
            for (String iban : ibans) {
                if (iban != null && !iban.isBlank()) {
                    references.add(where("extractedIbans").regex(separatorTolerant(iban, IBAN_SEPARATORS), "i"));
                }
            }
        }
        if (vatId != null && !vatId.isBlank()) {
            references.add(where("extractedVatId").regex(separatorTolerant(vatId, VAT_SEPARATORS), "i"));
        }
        if (aliases != null) {
            for (String alias : aliases) {
                if (alias != null && alias.trim().length() >= 3) {
                    references.add(where("extractedPartner").regex(Pattern.quote(alias.trim()), "i"));
                }
            }
        }
        if (references.isEmpty()) {
            return List.of();
        }
        Criteria criteria = new Criteria().andOperator(
                unassociated(userId),
                new Criteria().orOperator(references.toArray(new Criteria[0])));
        return mongoTemplate.find(newestFirst(criteria, limit), ReceiptFile.class);
    }

    @Override
    public List<ReceiptFile> findUnassociatedExtractedBetween(String userId, Instant from, Instant to, int limit) {
        Criteria criteria = new Criteria().andOperator(
                unassociated(userId),
                where("extractedDate").gte(from).lte(to));
        return mongoTemplate.find(newestFirst(criteria, limit), ReceiptFile.class);
    }

    @Override
    public List<ReceiptFile> findUnassociatedMailFiles(String userId, Collection<FileSourceType> sourceTypes,
                                                       Collection<String> senderDomains, Instant from, Instant to,
                                                       int limit) {
        List<Criteria> parts = new ArrayList<>();
        parts.add(unassociated(userId));
        parts.add(where("sourceType").in(sourceTypes));
        parts.add(where("createdAt").gte(from).lte(to));
        if (senderDomains != null && !senderDomains.isEmpty()) {
            Criteria[] domains = senderDomains.stream()
                    .map(d -> where("senderDomain").regex("(^|\\.)" + Pattern.quote(d.toLowerCase()) + "$"))
                    .toArray(Criteria[]::new);
            parts.add(new Criteria().orOperator(domains));
        }
        Criteria criteria = new Criteria().andOperator(parts.toArray(new Criteria[0]));
        return mongoTemplate.find(newestFirst(criteria, limit), ReceiptFile.class);
    }

    @Override
    public void linkTransaction(String fileId, String userId, String transactionId) {
        Query query = new Query(where("id").is(fileId).and("userId").is(userId));
        mongoTemplate.updateFirst(query, new Update().addToSet("transactionIds", transactionId), ReceiptFile.class);
    }

    private static Criteria unassociated(String userId) {
        return new Criteria().andOperator(
                where("userId").is(userId),
                where("extractionComplete").is(true),
                where("deletedAt").is(null),
                new Criteria().orOperator(
                        where("transactionIds").exists(false),
                        where("transactionIds").size(0)));
    }

    /**
     * Anchored pattern for a normalized identifier that also matches the stored form with separators
     * between characters, e.g. {@code DE89 3704 0044} for {@code DE8937040044}.
     */
    static String separatorTolerant(String normalized, String separators) {
        StringBuilder regex = new StringBuilder("^").append(separators).append('*');
        for (char c : normalized.toCharArray()) {
            regex.append(Character.isLetterOrDigit(c) ? String.valueOf(c) : Pattern.quote(String.valueOf(c)))
                    .append(separators).append('*');
        }
        return regex.append('$').toString();
    }

    private static Query newestFirst(Criteria criteria, int limit) {
        return new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(limit);
    }
}
