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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mail attachments sent from one of the partner's email domains or its website host (subdomains included).
 */
@Component
@RequiredArgsConstructor
public class EmailAttachmentStrategy implements MatchingStrategy {

    public static final String ID = "email_attachment";

    private final PrecisionSearchProperties properties;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isApplicable(Transaction transaction, SearchContext context) {
        if (transaction.getDate() == null || transaction.getPartnerId() == null) {
            return false;
        }
        return StrategySupport.resolvePartner(transaction, context)
                .map(p -> !StrategySupport.partnerDomains(p).isEmpty())
                .orElse(false);
    }

    @Override
    public StrategyOutcome search(Transaction transaction, SearchContext context) {
        Optional<Partner> resolved = StrategySupport.resolvePartner(transaction, context);
        if (resolved.isEmpty()) {
            return StrategyOutcome.empty();
        }
        Set<String> domains = StrategySupport.partnerDomains(resolved.get());
        if (domains.isEmpty()) {
            return StrategyOutcome.empty();
        }
        Duration window = Duration.ofDays(properties.getMailDateWindowDays());
        List<ReceiptFile> files = context.store().mailFiles(context.userId(), Set.of(FileSourceType.MAIL_ATTACHMENT),
                domains, transaction.getDate().minus(window), transaction.getDate().plus(window),
                properties.getMaxCandidatesPerQuery());

        List<MatchCandidate> candidates = new ArrayList<>();
        for (ReceiptFile file : StrategySupport.eligible(transaction, files)) {
            if (!MatchText.domainMatches(StrategySupport.senderDomain(file), domains)) {
                continue;
            }
            List<String> reasons = new ArrayList<>();
            reasons.add("sender_domain");
            double amount = MatchEvidence.amountCloseness(transaction.getAmount(), file.getExtractedAmount());
            double date = MatchEvidence.dateProximity(transaction.getDate(), file.effectiveDate());
            boolean keyword = MatchText.hasReceiptKeyword(file.getFileName(), file.getMailSubject());
            if (amount > 0) {
                reasons.add("amount_match");
            }
            if (keyword) {
                reasons.add("receipt_keyword");
            }
            double strength = 0.3 + 0.4 * amount + 0.2 * date + (keyword ? 0.1 : 0.0);
            if (MatchEvidence.isAmountMismatch(transaction.getAmount(), file.getExtractedAmount())) {
                reasons.add("amount_mismatch");
                strength *= 0.5;
            }
            candidates.add(new MatchCandidate(file, MatchSignal.of(SignalTier.DOMAIN_ALIAS, strength), reasons));
        }
        return StrategyOutcome.of(candidates);
    }
}
