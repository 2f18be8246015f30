package com.taxstudio.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff with additive jitter for re-enqueueing failed jobs.
 * Delay for retry n (1-based): min(base * 2^(n-1), max), plus up to {@code jitterFactor} of that delay.
 */
public final class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;

    public RetryPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Require 0 <= baseDelay <= maxDelay");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
    }

    /** Delay without jitter for the given 1-based retry count. */
    public Duration baseDelayFor(int retryCount) {
        int exponent = Math.min(Math.max(retryCount - 1, 0), 30);
        long millis = baseDelay.toMillis() * (1L << exponent);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    public Duration delayFor(int retryCount) {
        Duration delay = baseDelayFor(retryCount);
        long jitterBound = (long) (delay.toMillis() * jitterFactor);
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(0, jitterBound + 1) : 0;
        return delay.plusMillis(jitter);
    }

    /**
     * Default: 2 min base, 60 min ceiling, 25% jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(Duration.ofMinutes(2), Duration.ofMinutes(60), 0.25);
    }
}
