package com.taxstudio.suggestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxstudio.domain.Partner;
import com.taxstudio.domain.Transaction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Calls the AI query suggestion service: POST {base-url}/suggest-queries with
 * {@code {transaction, partner, maxQueries}}, expects {@code {queries: [...]}}. Rate-limited locally,
 * bounded by {@code timeout-ms}, answers cached per transaction.
 */
@Slf4j
public class WebClientQuerySuggestionService implements QuerySuggestionService {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SuggestionProperties properties;
    private final WebClient webClient;
    private final RateLimiter rateLimiter;

    public WebClientQuerySuggestionService(SuggestionProperties properties, WebClient.Builder webClientBuilder,
                                           RateLimiter rateLimiter) {
        this.properties = properties;
        this.webClient = webClientBuilder.baseUrl(properties.getBaseUrl()).build();
        this.rateLimiter = rateLimiter;
    }

    @Override
    @Cacheable(cacheNames = "querySuggestionCache", key = "#transaction.id + ':' + #maxQueries")
    public List<String> suggestQueries(Transaction transaction, Partner partner, int maxQueries) {
        if (!rateLimiter.acquirePermission()) {
            throw new QuerySuggestionException("Local limiter timeout before suggest-queries for transaction "
                    + transaction.getId());
        }
        SuggestQueriesRequest request = new SuggestQueriesRequest(
                TransactionPayload.of(transaction), PartnerPayload.of(partner), maxQueries);
        String response;
        try {
            response = webClient.post()
                    .uri("/suggest-queries")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                    .block();
        } catch (WebClientResponseException e) {
            throw new QuerySuggestionException("suggest-queries returned " + e.getStatusCode().value(), e);
        } catch (Exception e) {
            throw new QuerySuggestionException("suggest-queries failed: " + e.getMessage(), e);
        }
        List<String> queries = parseQueries(response, maxQueries);
        log.debug("Suggestion service returned {} queries for transaction {}", queries.size(), transaction.getId());
        return queries;
    }

    static List<String> parseQueries(String json, int maxQueries) {
        if (json == null || json.isBlank()) {
            throw new QuerySuggestionException("Empty suggest-queries response");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            throw new QuerySuggestionException("Unreadable suggest-queries response", e);
        }
        JsonNode queries = root.path("queries");
        if (!queries.isArray()) {
            throw new QuerySuggestionException("suggest-queries response has no queries array");
        }
        Set<String> out = new LinkedHashSet<>();
        for (JsonNode q : queries) {
            if (q.isTextual() && !q.asText().isBlank()) {
                out.add(q.asText().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT));
            }
            if (out.size() >= maxQueries) {
                break;
            }
        }
        return new ArrayList<>(out);
    }

    record SuggestQueriesRequest(TransactionPayload transaction, PartnerPayload partner, int maxQueries) {
    }

    record TransactionPayload(String id, String name, String description, String reference, String partner,
                              BigDecimal amount, String currency, Instant date) {

        static TransactionPayload of(Transaction tx) {
            return new TransactionPayload(tx.getId(), tx.getName(), tx.getDescription(), tx.getReference(),
                    tx.getPartner(), tx.getAmount(), tx.getCurrency(), tx.getDate());
        }
    }

    record PartnerPayload(String name, List<String> aliases, List<String> emailDomains, String website,
                          List<String> ibans, String vatId) {

        static PartnerPayload of(Partner partner) {
            if (partner == null) {
                return null;
            }
            return new PartnerPayload(partner.getName(), partner.getAliases(), partner.getEmailDomains(),
                    partner.getWebsite(), partner.getIbans(), partner.getVatId());
        }
    }
}
