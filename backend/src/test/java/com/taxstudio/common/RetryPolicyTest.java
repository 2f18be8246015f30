package com.taxstudio.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void baseDelayFor_doublesPerRetry() {
        RetryPolicy policy = new RetryPolicy(Duration.ofMinutes(2), Duration.ofMinutes(60), 0);
        assertThat(policy.baseDelayFor(1)).isEqualTo(Duration.ofMinutes(2));
        assertThat(policy.baseDelayFor(2)).isEqualTo(Duration.ofMinutes(4));
        assertThat(policy.baseDelayFor(3)).isEqualTo(Duration.ofMinutes(8));
    }

    @Test
    void baseDelayFor_cappedAtMax() {
        RetryPolicy policy = new RetryPolicy(Duration.ofMinutes(2), Duration.ofMinutes(60), 0);
        assertThat(policy.baseDelayFor(6)).isEqualTo(Duration.ofMinutes(60));
        assertThat(policy.baseDelayFor(40)).isEqualTo(Duration.ofMinutes(60));
    }

    @Test
    void delayFor_addsAtMostJitterFactor() {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(100), Duration.ofHours(1), 0.25);
        for (int i = 0; i < 50; i++) {
            Duration d = policy.delayFor(1);
            assertThat(d).isBetween(Duration.ofSeconds(100), Duration.ofSeconds(125));
        }
    }

    @Test
    void delayFor_withoutJitterIsDeterministic() {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(10), Duration.ofSeconds(30), 0);
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(20));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void constructor_rejectsMaxBelowBase() {
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofMinutes(10), Duration.ofMinutes(5), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultPolicy_startsAtTwoMinutes() {
        assertThat(RetryPolicy.defaultPolicy().baseDelayFor(1)).isEqualTo(Duration.ofMinutes(2));
        assertThat(RetryPolicy.defaultPolicy().baseDelayFor(10)).isEqualTo(Duration.ofMinutes(60));
    }
}
