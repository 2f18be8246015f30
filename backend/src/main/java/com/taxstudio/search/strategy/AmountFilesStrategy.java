package com.taxstudio.search.strategy;

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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Files whose extracted date is within the configured window and whose extracted amount is within the
 * configured tolerance of the transaction amount (absolute values).
 */
@Component
@RequiredArgsConstructor
public class AmountFilesStrategy implements MatchingStrategy {

    public static final String ID = "amount_files";

    private final PrecisionSearchProperties properties;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isApplicable(Transaction transaction, SearchContext context) {
        return transaction.getAmount() != null && transaction.getAmount().signum() != 0
                && transaction.getDate() != null;
    }

    @Override
    public StrategyOutcome search(Transaction transaction, SearchContext context) {
        Duration window = Duration.ofDays(properties.getAmountDateWindowDays());
        Instant from = transaction.getDate().minus(window);
        Instant to = transaction.getDate().plus(window);
        List<ReceiptFile> files = context.store().filesWithExtractedDateBetween(
                context.userId(), from, to, properties.getMaxCandidatesPerQuery());

        List<MatchCandidate> candidates = new ArrayList<>();
        for (ReceiptFile file : StrategySupport.eligible(transaction, files)) {
            if (!MatchEvidence.withinTolerance(transaction.getAmount(), file.getExtractedAmount(),
                    properties.getAmountTolerancePct())) {
                continue;
            }
            double amount = MatchEvidence.amountCloseness(transaction.getAmount(), file.getExtractedAmount());
            double date = MatchEvidence.dateProximity(transaction.getDate(), file.getExtractedDate());
            double strength = amount * (0.5 + 0.5 * date);
            candidates.add(new MatchCandidate(file, MatchSignal.of(SignalTier.AMOUNT_DATE, strength),
                    List.of("amount_match", date > 0 ? "date_close" : "date_in_window")));
        }
        return StrategyOutcome.of(candidates);
    }
}
