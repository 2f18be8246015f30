package com.taxstudio.suggestion;

import com.taxstudio.domain.Partner;
import com.taxstudio.domain.Transaction;

import java.util.List;

/**
 * Produces ranked search queries (best first) for finding a transaction's receipt among mail-derived files.
 * Queries are lowercase; {@code from:<domain>} restricts a query to a sender domain.
 */
public interface QuerySuggestionService {

    /**
     * @param partner resolved partner, or null when the transaction has none
     * @throws QuerySuggestionException when the suggestion backend fails or times out
     */
    List<String> suggestQueries(Transaction transaction, Partner partner, int maxQueries);
}
