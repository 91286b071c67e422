package com.chaincollector.unit.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chaincollector.exception.CircuitOpenException;
import com.chaincollector.exception.CredentialsException;
import com.chaincollector.exception.ProviderException;
import com.chaincollector.exception.RetryExhaustedException;
import com.chaincollector.resilience.RetryPolicy;
import com.chaincollector.resilience.RetrySettings;
import com.chaincollector.unit.support.MutableClock;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for RetryPolicy: attempt accounting, classification and backoff shape.
 */
class RetryPolicyTest {

    private static final RetrySettings FAST = RetrySettings.builder()
            .maxAttempts(4)
            .maxElapsed(Duration.ofSeconds(5))
            .backoffBase(Duration.ofMillis(1))
            .backoffCap(Duration.ofMillis(2))
            .jitter(false)
            .build();

    private static RetryPolicy policy(RetrySettings settings) {
        return new RetryPolicy(settings, Clock.systemUTC(), new Random(11));
    }

    private static ProviderException transientFailure() {
        return new ProviderException("read timed out", new SocketTimeoutException("timeout"), true);
    }

    @Nested
    @DisplayName("Attempts")
    class Attempts {

        @Test
        @DisplayName("Transient failures are retried until the call succeeds")
        void retriesUntilSuccess() {
            AtomicInteger calls = new AtomicInteger();

            String result = policy(FAST).execute("quotes", () -> {
                if (calls.incrementAndGet() < 3) {
                    throw transientFailure();
                }
                return "ok";
            });

            assertThat(result).isEqualTo("ok");
            assertThat(calls).hasValue(3);
        }

        @Test
        @DisplayName("Exhausting all attempts wraps the last failure")
        void exhaustion() {
            AtomicInteger calls = new AtomicInteger();
            ProviderException last = transientFailure();

            assertThatThrownBy(() -> policy(FAST).execute("quotes", () -> {
                calls.incrementAndGet();
                throw last;
            }))
                    .isInstanceOf(RetryExhaustedException.class)
                    .hasCause(last)
                    .satisfies(e -> assertThat(((RetryExhaustedException) e).getAttempts()).isEqualTo(4));
            assertThat(calls).hasValue(4);
        }

        @Test
        @DisplayName("Running past the elapsed budget stops retrying before maxAttempts")
        void elapsedBudget() {
            MutableClock clock = MutableClock.atIst(2025, 6, 11, 10, 0);
            RetryPolicy policy = new RetryPolicy(FAST, clock, new Random(11));
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> policy.execute("quotes", () -> {
                calls.incrementAndGet();
                clock.advance(Duration.ofSeconds(3));
                throw transientFailure();
            }))
                    .isInstanceOf(RetryExhaustedException.class)
                    .satisfies(e -> assertThat(((RetryExhaustedException) e).getAttempts()).isEqualTo(2));
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("A non-retryable failure is rethrown unchanged after one attempt")
        void nonRetryable() {
            AtomicInteger calls = new AtomicInteger();
            IllegalStateException bug = new IllegalStateException("bad state");

            assertThatThrownBy(() -> policy(FAST).execute("quotes", () -> {
                calls.incrementAndGet();
                throw bug;
            })).isSameAs(bug);
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("An open circuit is never retried")
        void circuitOpenNotRetried() {
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> policy(FAST).execute("quotes", () -> {
                calls.incrementAndGet();
                throw new CircuitOpenException("kite.quote", Duration.ofSeconds(5));
            })).isInstanceOf(CircuitOpenException.class);
            assertThat(calls).hasValue(1);
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("Timeouts anywhere in the cause chain are retryable by default")
        void defaultTransient() {
            RetryPolicy policy = policy(FAST);

            assertThat(policy.isRetryable(new RuntimeException(new SocketTimeoutException()))).isTrue();
            assertThat(policy.isRetryable(transientFailure())).isTrue();
            assertThat(policy.isRetryable(new ProviderException("400 bad request"))).isFalse();
        }

        @Test
        @DisplayName("Blacklist wins over the default transient kinds")
        void blacklist() {
            RetryPolicy policy = policy(FAST.toBuilder().blacklisted(ProviderException.class).build());

            assertThat(policy.isRetryable(transientFailure())).isFalse();
        }

        @Test
        @DisplayName("A whitelist restricts retries to the listed types")
        void whitelist() {
            RetryPolicy policy = policy(FAST.toBuilder().whitelisted(IllegalStateException.class).build());

            assertThat(policy.isRetryable(new IllegalStateException("flaky"))).isTrue();
            assertThat(policy.isRetryable(transientFailure())).isFalse();
        }

        @Test
        @DisplayName("Credential failures can be blacklisted")
        void credentialsBlacklisted() {
            RetryPolicy policy = policy(FAST.toBuilder().blacklisted(CredentialsException.class).build());

            assertThat(policy.isRetryable(new CredentialsException("token expired"))).isFalse();
        }
    }

    @Test
    @DisplayName("Base delay doubles per attempt and is capped")
    void baseDelay() {
        RetryPolicy policy = policy(RetrySettings.builder()
                .backoffBase(Duration.ofMillis(200))
                .backoffCap(Duration.ofMillis(2500))
                .build());

        assertThat(policy.baseDelay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.baseDelay(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.baseDelay(4)).isEqualTo(Duration.ofMillis(1600));
        assertThat(policy.baseDelay(5)).isEqualTo(Duration.ofMillis(2500));
        assertThat(policy.baseDelay(9)).isEqualTo(Duration.ofMillis(2500));
    }
}
