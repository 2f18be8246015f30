package com.taxstudio.suggestion;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AI query suggestion client. Documented in application.yml under taxstudio.suggestion.
 */
@ConfigurationProperties(prefix = "taxstudio.suggestion")
@NoArgsConstructor
@Getter
@Setter
public class SuggestionProperties {

    /**
     * Base URL of the suggestion service. When blank, queries are generated locally by
     * {@link HeuristicQuerySuggestionService}.
     */
    private String baseUrl;

    /** Per-request timeout. */
    private long timeoutMs = 10_000;

    /** Local rate limit for outbound calls. */
    private int requestsPerSecond = 5;

    /** Max time to wait for a limiter permit before failing the call. */
    private long limiterTimeoutMs = 2_000;

    /** TTL of cached suggestions per transaction. */
    private long cacheTtlMinutes = 30;
}
