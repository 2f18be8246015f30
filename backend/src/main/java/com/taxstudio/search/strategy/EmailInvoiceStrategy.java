package com.taxstudio.search.strategy;

import com.taxstudio.common.MatchText;
import com.taxstudio.domain.FileSourceType;
import com.taxstudio.domain.Partner;
import com.taxstudio.domain.ReceiptFile;
import com.taxstudio.domain.Transaction;
import com.taxstudio.search.config.PrecisionSearchProperties;
import com.taxstudio.search.scoring.MatchCandidate;
import com.taxstudio.search.scoring.MatchEvidence;
import com.taxstudio.search.scoring.MatchSignal;
import com.taxstudio.search.scoring.SignalTier;
import com.taxstudio.suggestion.QuerySuggestionException;
import com.taxstudio.suggestion.QuerySuggestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Mail-derived files (attachments and invoice bodies) whose text covers one of the queries suggested for
 * the transaction. Earlier queries weigh more. A suggestion failure yields an error outcome without candidates.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailInvoiceStrategy implements MatchingStrategy {

    public static final String ID = "email_invoice";
    private static final Set<FileSourceType> SOURCES =
            Set.of(FileSourceType.MAIL_ATTACHMENT, FileSourceType.MAIL_INVOICE_BODY);

    private final PrecisionSearchProperties properties;
    private final QuerySuggestionService querySuggestionService;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isApplicable(Transaction transaction, SearchContext context) {
        return transaction.getDate() != null
                && (hasText(transaction.getName()) || hasText(transaction.getPartner())
                || transaction.getPartnerId() != null);
    }

    @Override
    public StrategyOutcome search(Transaction transaction, SearchContext context) {
        Partner partner = StrategySupport.resolvePartner(transaction, context).orElse(null);
        List<String> queries;
        try {
            queries = querySuggestionService.suggestQueries(transaction, partner, properties.getMaxSuggestedQueries());
        } catch (QuerySuggestionException e) {
            log.warn("Query suggestion failed for transaction {} in queue {}: {}",
                    transaction.getId(), context.queueId(), e.getMessage());
            return StrategyOutcome.failed("Query suggestion failed: " + e.getMessage());
        }
        if (queries == null || queries.isEmpty()) {
            return StrategyOutcome.empty();
        }

        Duration window = Duration.ofDays(properties.getMailDateWindowDays());
        List<ReceiptFile> files = context.store().mailFiles(context.userId(), SOURCES, null,
                transaction.getDate().minus(window), transaction.getDate().plus(window),
                properties.getMaxCandidatesPerQuery());

        List<MatchCandidate> candidates = new ArrayList<>();
        for (ReceiptFile file : StrategySupport.eligible(transaction, files)) {
            if (file.getSourceType() == null || !file.getSourceType().isMailDerived()) {
                continue;
            }
            int rank = firstMatchingQuery(queries, file);
            if (rank < 0) {
                continue;
            }
            double rankWeight = Math.max(0.5, 1.0 - 0.1 * rank);
            double amount = MatchEvidence.amountCloseness(transaction.getAmount(), file.getExtractedAmount());
            double date = MatchEvidence.dateProximity(transaction.getDate(), file.effectiveDate());
            double strength = 0.35 * rankWeight + 0.45 * amount + 0.2 * date;
            List<String> reasons = new ArrayList<>();
            reasons.add("query:" + queries.get(rank));
            if (MatchEvidence.isAmountMismatch(transaction.getAmount(), file.getExtractedAmount())) {
                reasons.add("amount_mismatch");
                strength *= 0.5;
            }
            candidates.add(new MatchCandidate(file, MatchSignal.of(SignalTier.AI_QUERY_HIT, strength), reasons));
        }
        return StrategyOutcome.of(candidates);
    }

    /** Index of the first query the file satisfies, or -1. */
    static int firstMatchingQuery(List<String> queries, ReceiptFile file) {
        String text = searchableText(file);
        String domain = StrategySupport.senderDomain(file);
        for (int i = 0; i < queries.size(); i++) {
            if (matches(queries.get(i), text, domain)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Every {@code from:} term must match the sender domain and every other token (3+ chars) must occur in
     * the file's text. A query with no usable term matches nothing.
     */
    static boolean matches(String query, String text, String senderDomain) {
        boolean anyTerm = false;
        for (String part : query.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (part.startsWith("from:")) {
                String domain = part.substring("from:".length());
                if (domain.isEmpty() || !MatchText.domainMatches(senderDomain, List.of(domain))) {
                    return false;
                }
                anyTerm = true;
                continue;
            }
            for (String token : MatchText.tokens(part)) {
                if (!text.contains(token)) {
                    return false;
                }
                anyTerm = true;
            }
        }
        return anyTerm;
    }

    private static String searchableText(ReceiptFile file) {
        return Stream.of(file.getFileName(), file.getMailSubject(), file.getExtractedText(),
                        file.getExtractedPartner(), file.getSenderEmail())
                .filter(s -> s != null && !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
