package com.taxstudio.search.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Precision search pipeline config. Documented in application.yml under taxstudio.precision-search.
 */
@ConfigurationProperties(prefix = "taxstudio.precision-search")
@NoArgsConstructor
@Getter
@Setter
public class PrecisionSearchProperties {

    /** Retries of a failed job before it stays FAILED. */
    private int maxRetries = 3;

    /** Relative amount tolerance (percent) for amount_files. */
    private double amountTolerancePct = 5.0;

    /** Extracted-date window (± days) for amount_files. */
    private int amountDateWindowDays = 90;

    /** File date window (± days) for the mail strategies. */
    private int mailDateWindowDays = 180;

    /** Upper bound on candidate files loaded per store query. */
    private int maxCandidatesPerQuery = 50;

    /** Worker lease; renewed on every progress save. A PROCESSING item past its lease is re-claimable. */
    private long leaseDurationMs = 300_000;

    /** How often (ms) pending items whose queued event was lost are picked up. */
    private long pollIntervalMs = 30_000;

    /** Max pending items started per poll. */
    private int pollBatchSize = 20;

    /** How often (ms) PROCESSING items with an expired lease are re-claimed. */
    private long staleSweepIntervalMs = 60_000;

    /** How often (ms) the retry scheduler polls for FAILED items. */
    private long retrySchedulerIntervalMs = 120_000;

    /** Base delay in minutes for exponential backoff between retries. */
    private long retryBaseDelayMinutes = 2;

    /** Maximum delay in minutes (backoff ceiling). */
    private long retryMaxDelayMinutes = 60;

    /** Terminal items older than this are deleted. */
    private int retentionDays = 7;

    /** Queries requested from the suggestion service per transaction. */
    private int maxSuggestedQueries = 5;
}
