package com.taxstudio.suggestion;

import com.taxstudio.domain.Partner;
import com.taxstudio.domain.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicQuerySuggestionServiceTest {

    private final HeuristicQuerySuggestionService service = new HeuristicQuerySuggestionService();

    @Test
    @DisplayName("invoice numbers rank first, then partner names and sender domains")
    void rankingWithPartner() {
        Transaction tx = new Transaction();
        tx.setId("t1");
        tx.setName("HETZNER ONLINE GMBH");
        tx.setDescription("RE-2024-001234 Hetzner");
        Partner partner = new Partner();
        partner.setId("p1");
        partner.setName("Hetzner Online GmbH");
        partner.setEmailDomains(new ArrayList<>(List.of("hetzner.com")));

        List<String> queries = service.suggestQueries(tx, partner, 5);

        assertThat(queries).containsExactly(
                "re-2024-001234", "2024-001234", "hetzner online", "hetzner", "from:hetzner.com");
    }

    @Test
    @DisplayName("bank statement counterparty is cleaned when no partner is linked")
    void counterpartyWithoutPartner() {
        Transaction tx = new Transaction();
        tx.setId("t2");
        tx.setName("PP*Spotify AB 123456789");
        tx.setPartner("PP*Spotify AB 123456789");

        List<String> queries = service.suggestQueries(tx, null, 10);

        assertThat(queries).containsExactly(
                "123456789", "spotify ab", "spotify", "spotify ab rechnung", "spotify ab invoice");
    }

    @Test
    void maxQueriesRespected() {
        Transaction tx = new Transaction();
        tx.setPartner("Deutsche Bahn");

        assertThat(service.suggestQueries(tx, null, 2)).containsExactly("deutsche bahn", "deutsche");
        assertThat(service.suggestQueries(new Transaction(), null, 5)).isEmpty();
    }

    @Test
    void invoiceNumbers() {
        assertThat(HeuristicQuerySuggestionService.invoiceNumbers("Invoice #INV-10023 for order 4711"))
                .containsExactly("INV-10023", "order 4711");
        assertThat(HeuristicQuerySuggestionService.invoiceNumbers("Ref 2023/98765")).containsExactly("2023-98765");
        assertThat(HeuristicQuerySuggestionService.invoiceNumbers(null)).isEmpty();
    }
}
