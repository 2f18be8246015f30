package com.taxstudio.search.strategy;

import com.taxstudio.domain.ReceiptFile;
import com.taxstudio.domain.Transaction;
import com.taxstudio.search.config.PrecisionSearchProperties;
import com.taxstudio.search.scoring.MatchCandidate;
import com.taxstudio.search.scoring.SignalTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AmountFilesStrategyTest {

    private static final Instant TX_DATE = Instant.parse("2025-06-01T00:00:00Z");

    @Mock
    private SearchStore store;

    private AmountFilesStrategy strategy;
    private SearchContext context;
    private Transaction tx;

    @BeforeEach
    void setUp() {
        strategy = new AmountFilesStrategy(new PrecisionSearchProperties());
        context = new SearchContext("u1", "q1", store);
        tx = new Transaction();
        tx.setId("t1");
        tx.setUserId("u1");
        tx.setAmount(new BigDecimal("-49.99"));
        tx.setDate(TX_DATE);
    }

    @Test
    @DisplayName("keeps files within 5% of the absolute amount, graded by amount and date closeness")
    void toleranceFilter() {
        ReceiptFile close = file("close", "50.00", TX_DATE.plus(Duration.ofDays(2)));
        ReceiptFile tooFar = file("too-far", "60.00", TX_DATE);
        ReceiptFile noAmount = file("no-amount", null, TX_DATE);
        when(store.filesWithExtractedDateBetween(eq("u1"), any(), any(), anyInt()))
                .thenReturn(List.of(close, tooFar, noAmount));

        StrategyOutcome outcome = strategy.search(tx, context);

        assertThat(outcome.candidates()).extracting(MatchCandidate::fileId).containsExactly("close");
        MatchCandidate c = outcome.candidates().get(0);
        assertThat(c.signal().tier()).isEqualTo(SignalTier.AMOUNT_DATE);
        // closeness 0.95 (within 1%), date 0.8 (2 days)
        assertThat(c.signal().strength()).isCloseTo(0.95 * 0.9, within(1e-9));
        assertThat(c.reasons()).containsExactly("amount_match", "date_close");
    }

    @Test
    @DisplayName("queries the store with a ±90 day window around the transaction date")
    void dateWindow() {
        when(store.filesWithExtractedDateBetween(eq("u1"), any(), any(), anyInt())).thenReturn(List.of());

        assertThat(strategy.search(tx, context).candidates()).isEmpty();

        verify(store).filesWithExtractedDateBetween("u1", TX_DATE.minus(Duration.ofDays(90)),
                TX_DATE.plus(Duration.ofDays(90)), 50);
    }

    @Test
    void notApplicableWithoutAmountOrDate() {
        assertThat(strategy.isApplicable(tx, context)).isTrue();

        tx.setAmount(BigDecimal.ZERO);
        assertThat(strategy.isApplicable(tx, context)).isFalse();

        tx.setAmount(new BigDecimal("-10"));
        tx.setDate(null);
        assertThat(strategy.isApplicable(tx, context)).isFalse();
    }

    private static ReceiptFile file(String id, String amount, Instant date) {
        ReceiptFile f = new ReceiptFile();
        f.setId(id);
        f.setUserId("u1");
        f.setExtractedAmount(amount == null ? null : new BigDecimal(amount));
        f.setExtractedDate(date);
        f.setExtractionComplete(true);
        return f;
    }
}
