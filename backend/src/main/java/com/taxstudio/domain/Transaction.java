package com.taxstudio.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Financial transaction that needs a supporting receipt. Amounts are signed (expenses negative) and
 * stored as Decimal128. {@code isComplete} flips once a qualifying file is attached or a
 * no-receipt category is set; the precision search pipeline only ever adds files, never removes them.
 */
@Document(collection = "transactions")
@CompoundIndexes({
    @CompoundIndex(name = "user_complete_date", def = "{'userId': 1, 'isComplete': 1, 'date': -1}"),
    @CompoundIndex(name = "user_partner", def = "{'userId': 1, 'partnerId': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Transaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private BigDecimal amount;
    private String currency;
    private Instant date;
    private String name;
    private String description;
    private String reference;
    /** Free-text counterparty as it appears on the bank statement. */
    private String partner;
    private String counterpartyIban;
    private String partnerId;
    private PartnerType partnerType;
    private List<String> fileIds = new ArrayList<>();
    /** Files the user detached manually; automation must not attach them again. */
    private List<String> rejectedFileIds = new ArrayList<>();
    private String noReceiptCategoryId;
    @Field("isComplete")
    private boolean complete;
    private MatchProvenance matchProvenance;
    private Instant updatedAt;

    public boolean hasRejected(String fileId) {
        return rejectedFileIds != null && rejectedFileIds.contains(fileId);
    }
}
