package com.taxstudio.search.strategy;

import com.taxstudio.common.MatchText;
import com.taxstudio.domain.Partner;
import com.taxstudio.domain.ReceiptFile;
import com.taxstudio.domain.Transaction;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class StrategySupport {

    private StrategySupport() {
    }

    static Optional<Partner> resolvePartner(Transaction transaction, SearchContext context) {
        return context.store().findPartner(context.userId(), transaction.getPartnerId());
    }

    /** Drops deleted, unextracted and already attached files, and files the user rejected for this transaction. */
    static List<ReceiptFile> eligible(Transaction transaction, List<ReceiptFile> files) {
        return files.stream()
                .filter(f -> f.getDeletedAt() == null && f.isExtractionComplete())
                .filter(f -> f.getTransactionIds() == null || f.getTransactionIds().isEmpty())
                .filter(f -> !transaction.hasRejected(f.getId()))
                .filter(f -> transaction.getFileIds() == null || !transaction.getFileIds().contains(f.getId()))
                .toList();
    }

    /** Partner email domains plus its website host, lowercase. */
    static Set<String> partnerDomains(Partner partner) {
        Set<String> domains = new LinkedHashSet<>();
        for (String d : partner.getEmailDomains()) {
            if (d != null && !d.isBlank()) {
                domains.add(d.trim().toLowerCase());
            }
        }
        String host = MatchText.websiteHost(partner.getWebsite());
        if (host != null) {
            domains.add(host);
        }
        return domains;
    }

    /** Sender domain of a mail-derived file, falling back to the sender address. */
    static String senderDomain(ReceiptFile file) {
        return file.getSenderDomain() != null ? file.getSenderDomain().toLowerCase()
                : MatchText.emailDomain(file.getSenderEmail());
    }
}
