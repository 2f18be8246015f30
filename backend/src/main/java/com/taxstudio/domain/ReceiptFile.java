package com.taxstudio.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Receipt candidate produced by ingestion (upload, mail sync, bank file store). Extracted fields are
 * filled by the extraction step; precision search only reads them and back-links {@code transactionIds}.
 */
@Document(collection = "files")
@CompoundIndexes({
    @CompoundIndex(name = "user_partner", def = "{'userId': 1, 'partnerId': 1}"),
    @CompoundIndex(name = "user_extracted_date", def = "{'userId': 1, 'extractedDate': 1}"),
    @CompoundIndex(name = "user_source_domain", def = "{'userId': 1, 'sourceType': 1, 'senderDomain': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ReceiptFile {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String fileName;
    /** MIME type. */
    private String fileType;
    private String storagePath;
    private FileSourceType sourceType;
    private String senderEmail;
    /** Lowercase sender domain for mail-derived files. */
    private String senderDomain;
    private String mailSubject;
    private String mailIntegrationId;
    private String partnerId;
    private BigDecimal extractedAmount;
    private Instant extractedDate;
    private String extractedPartner;
    private List<String> extractedIbans = new ArrayList<>();
    private String extractedVatId;
    private String extractedText;
    private boolean extractionComplete;
    private List<String> transactionIds = new ArrayList<>();
    private Instant deletedAt;
    private Instant createdAt;

    /** Extracted document date, falling back to the ingestion time. */
    public Instant effectiveDate() {
        return extractedDate != null ? extractedDate : createdAt;
    }
}
