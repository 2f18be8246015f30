package com.taxstudio.search.strategy;

import com.taxstudio.domain.FileSourceType;
import com.taxstudio.domain.Partner;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailAttachmentStrategyTest {

    private static final Instant TX_DATE = Instant.parse("2025-04-15T00:00:00Z");

    @Mock
    private SearchStore store;

    private EmailAttachmentStrategy strategy;
    private SearchContext context;
    private Partner partner;
    private Transaction tx;

    @BeforeEach
    void setUp() {
        strategy = new EmailAttachmentStrategy(new PrecisionSearchProperties());
        context = new SearchContext("u1", "q1", store);
        partner = new Partner();
        partner.setId("p1");
        partner.setName("Hetzner");
        partner.setEmailDomains(new ArrayList<>(List.of("Hetzner.com")));
        tx = new Transaction();
        tx.setId("t1");
        tx.setUserId("u1");
        tx.setPartnerId("p1");
        tx.setAmount(new BigDecimal("-119.00"));
        tx.setDate(TX_DATE);
    }

    @Test
    @DisplayName("attachment from a partner subdomain with receipt keyword scores at the top of its tier")
    void subdomainSenderMatches() {
        when(store.findPartner("u1", "p1")).thenReturn(Optional.of(partner));
        ReceiptFile fromSubdomain = mailFile("f1", "mail.hetzner.com", "Rechnung_2025.pdf");
        ReceiptFile lookalike = mailFile("f2", "evil-hetzner.com", "Rechnung.pdf");
        when(store.mailFiles(eq("u1"), eq(Set.of(FileSourceType.MAIL_ATTACHMENT)), eq(Set.of("hetzner.com")),
                eq(TX_DATE.minus(Duration.ofDays(180))), eq(TX_DATE.plus(Duration.ofDays(180))), anyInt()))
                .thenReturn(List.of(fromSubdomain, lookalike));

        StrategyOutcome outcome = strategy.search(tx, context);

        assertThat(outcome.candidates()).extracting(MatchCandidate::fileId).containsExactly("f1");
        MatchCandidate c = outcome.candidates().get(0);
        assertThat(c.signal().tier()).isEqualTo(SignalTier.DOMAIN_ALIAS);
        assertThat(c.signal().strength()).isCloseTo(1.0, within(1e-9));
        assertThat(c.reasons()).containsExactly("sender_domain", "amount_match", "receipt_keyword");
    }

    @Test
    @DisplayName("website host counts as a sender domain")
    void websiteHostUsed() {
        partner.setEmailDomains(new ArrayList<>());
        partner.setWebsite("https://www.hetzner.de/cloud");
        when(store.findPartner("u1", "p1")).thenReturn(Optional.of(partner));

        assertThat(strategy.isApplicable(tx, context)).isTrue();
    }

    @Test
    void notApplicableWithoutPartnerDomains() {
        partner.setEmailDomains(new ArrayList<>());
        when(store.findPartner("u1", "p1")).thenReturn(Optional.of(partner));

        assertThat(strategy.isApplicable(tx, context)).isFalse();
    }

    private static ReceiptFile mailFile(String id, String senderDomain, String fileName) {
        ReceiptFile f = new ReceiptFile();
        f.setId(id);
        f.setUserId("u1");
        f.setSourceType(FileSourceType.MAIL_ATTACHMENT);
        f.setSenderDomain(senderDomain);
        f.setFileName(fileName);
        f.setExtractedAmount(new BigDecimal("119.00"));
        f.setExtractedDate(TX_DATE);
        f.setExtractionComplete(true);
        return f;
    }
}
