package com.taxstudio.search.strategy;

import com.taxstudio.common.MatchText;
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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Files that reference the transaction's partner by id, sender domain, IBAN, VAT id or alias.
 * An extracted IBAN or VAT id equal to the partner's (or the transaction's counterparty IBAN) is exact
 * evidence unless the amounts disagree; everything else is graded as domain/alias evidence.
 */
@Component
@RequiredArgsConstructor
public class PartnerFilesStrategy implements MatchingStrategy {

    public static final String ID = "partner_files";

    private final PrecisionSearchProperties properties;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isApplicable(Transaction transaction, SearchContext context) {
        return transaction.getPartnerId() != null && StrategySupport.resolvePartner(transaction, context).isPresent();
    }

    @Override
    public StrategyOutcome search(Transaction transaction, SearchContext context) {
        Optional<Partner> resolved = StrategySupport.resolvePartner(transaction, context);
        if (resolved.isEmpty()) {
            return StrategyOutcome.empty();
        }
        Partner partner = resolved.get();
        Set<String> ibans = new LinkedHashSet<>();
        for (String iban : partner.getIbans()) {
            String normalized = MatchText.normalizeIban(iban);
            if (normalized != null) {
                ibans.add(normalized);
            }
        }
        String counterpartyIban = MatchText.normalizeIban(transaction.getCounterpartyIban());
        if (counterpartyIban != null) {
            ibans.add(counterpartyIban);
        }

        List<ReceiptFile> files = context.store().filesReferencingPartner(context.userId(), partner,
                StrategySupport.partnerDomains(partner), ibans, properties.getMaxCandidatesPerQuery());
        List<MatchCandidate> candidates = new ArrayList<>();
        for (ReceiptFile file : StrategySupport.eligible(transaction, files)) {
            candidates.add(evaluate(transaction, partner, ibans, file));
        }
        return StrategyOutcome.of(candidates);
    }

    MatchCandidate evaluate(Transaction transaction, Partner partner, Set<String> ibans, ReceiptFile file) {
        List<String> reasons = new ArrayList<>();
        boolean ibanHit = file.getExtractedIbans() != null && file.getExtractedIbans().stream()
                .map(MatchText::normalizeIban)
                .anyMatch(ibans::contains);
        String vatId = MatchText.normalizeVatId(partner.getVatId());
        boolean vatHit = vatId != null && vatId.equals(MatchText.normalizeVatId(file.getExtractedVatId()));
        if (ibanHit) {
            reasons.add("iban_match");
        }
        if (vatHit) {
            reasons.add("vat_match");
        }

        double amount = MatchEvidence.amountCloseness(transaction.getAmount(), file.getExtractedAmount());
        double date = MatchEvidence.dateProximity(transaction.getDate(), file.effectiveDate());
        boolean mismatch = MatchEvidence.isAmountMismatch(transaction.getAmount(), file.getExtractedAmount());
        if (amount > 0) {
            reasons.add("amount_match");
        }
        if (mismatch) {
            reasons.add("amount_mismatch");
        }

        if ((ibanHit || vatHit) && !mismatch) {
            double strength = 0.3 + 0.4 * amount + 0.3 * date;
            return new MatchCandidate(file, MatchSignal.of(SignalTier.IBAN_VAT_EXACT, strength), reasons);
        }

        boolean partnerRef = partner.getId().equals(file.getPartnerId());
        boolean keyword = MatchText.hasReceiptKeyword(file.getFileName(), file.getMailSubject());
        if (partnerRef) {
            reasons.add("partner_reference");
        }
        double strength = 0.45 * amount + 0.25 * date + (partnerRef ? 0.15 : 0.0) + (keyword ? 0.15 : 0.0);
        if (mismatch) {
            strength *= 0.4;
        }
        return new MatchCandidate(file, MatchSignal.of(SignalTier.DOMAIN_ALIAS, strength), reasons);
    }
}
