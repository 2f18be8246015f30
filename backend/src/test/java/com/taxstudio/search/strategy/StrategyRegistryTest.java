package com.taxstudio.search.strategy;

import com.taxstudio.search.config.PrecisionSearchProperties;
import com.taxstudio.suggestion.QuerySuggestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class StrategyRegistryTest {

    private final PrecisionSearchProperties properties = new PrecisionSearchProperties();
    private final QuerySuggestionService suggestions = mock(QuerySuggestionService.class);

    @Test
    @DisplayName("default order runs exact partner evidence first and AI queries last")
    void defaultOrder() {
        StrategyRegistry registry = new StrategyRegistry(allStrategies());

        assertThat(registry.defaultOrder())
                .containsExactly("partner_files", "amount_files", "email_attachment", "email_invoice");
        assertThat(registry.find("amount_files")).get().isInstanceOf(AmountFilesStrategy.class);
        assertThat(registry.find("unknown")).isEmpty();
    }

    @Test
    void duplicateIdRejected() {
        List<MatchingStrategy> strategies = new ArrayList<>(allStrategies());
        strategies.add(new AmountFilesStrategy(properties));

        assertThatThrownBy(() -> new StrategyRegistry(strategies))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("amount_files");
    }

    @Test
    void missingDefaultStrategyRejected() {
        assertThatThrownBy(() -> new StrategyRegistry(List.of(new PartnerFilesStrategy(properties))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("amount_files");
    }

    private List<MatchingStrategy> allStrategies() {
        return List.of(
                new PartnerFilesStrategy(properties),
                new AmountFilesStrategy(properties),
                new EmailAttachmentStrategy(properties),
                new EmailInvoiceStrategy(properties, suggestions));
    }
}
