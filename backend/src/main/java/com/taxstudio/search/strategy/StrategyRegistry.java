package com.taxstudio.search.strategy;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue of matching strategies by id. The default order is what new queue items persist; items keep
 * their own list, so reordering here never affects jobs already queued.
 */
@Component
public class StrategyRegistry {

    public static final List<String> DEFAULT_ORDER = List.of(
            PartnerFilesStrategy.ID,
            AmountFilesStrategy.ID,
            EmailAttachmentStrategy.ID,
            EmailInvoiceStrategy.ID);

    private final Map<String, MatchingStrategy> byId = new LinkedHashMap<>();

    public StrategyRegistry(List<MatchingStrategy> strategies) {
        for (MatchingStrategy strategy : strategies) {
            MatchingStrategy previous = byId.putIfAbsent(strategy.id(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate matching strategy id: " + strategy.id());
            }
        }
        for (String id : DEFAULT_ORDER) {
            if (!byId.containsKey(id)) {
                throw new IllegalStateException("No matching strategy registered for default id: " + id);
            }
        }
    }

    public Optional<MatchingStrategy> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<String> defaultOrder() {
        return DEFAULT_ORDER;
    }
}
