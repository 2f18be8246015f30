package com.taxstudio.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Search log of one transaction within one precision search job: which strategies ran, what they found,
 * and which strategy (if any) connected a file.
 */
@Document(collection = "transaction_searches")
@CompoundIndexes({
    @CompoundIndex(name = "transaction_queue", def = "{'transactionId': 1, 'queueId': 1}", unique = true),
    @CompoundIndex(name = "transaction_created", def = "{'transactionId': 1, 'createdAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransactionSearchEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String transactionId;
    private String queueId;
    private String userId;
    private SearchTrigger triggeredBy;
    private List<String> strategiesAttempted = new ArrayList<>();
    private List<SearchAttempt> attempts = new ArrayList<>();
    /** Strategy that connected a file. */
    private String automationSource;
    private int totalFilesConnected;
    private Instant createdAt;
    private Instant updatedAt;
}
