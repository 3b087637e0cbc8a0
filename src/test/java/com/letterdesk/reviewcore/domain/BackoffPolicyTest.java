package com.letterdesk.reviewcore.domain;

import com.letterdesk.reviewcore.domain.generation.BackoffPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void twoRetriesMeansThreeAttempts() {
        BackoffPolicy policy = new BackoffPolicy(2, Duration.ofSeconds(1), Duration.ZERO);

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    void delayDoublesPerRetry() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofMillis(500), Duration.ZERO);

        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayBeforeRetry(3)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void jitterStaysWithinBound() {
        BackoffPolicy policy = new BackoffPolicy(1, Duration.ofMillis(100), Duration.ofMillis(50));

        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayBeforeRetry(1)).isBetween(Duration.ofMillis(100), Duration.ofMillis(150));
        }
    }

    @Test
    void noRetriesNeverRetries() {
        assertThat(BackoffPolicy.noRetries().canRetry(1)).isFalse();
        assertThatThrownBy(() -> new BackoffPolicy(-1, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
