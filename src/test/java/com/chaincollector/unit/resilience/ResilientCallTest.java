package com.chaincollector.unit.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chaincollector.exception.CircuitOpenException;
import com.chaincollector.exception.ProviderException;
import com.chaincollector.exception.RetryExhaustedException;
import com.chaincollector.resilience.BreakerConfig;
import com.chaincollector.resilience.BreakerRegistry;
import com.chaincollector.resilience.CircuitState;
import com.chaincollector.resilience.ResilientCall;
import com.chaincollector.resilience.RetryPolicy;
import com.chaincollector.resilience.RetrySettings;
import com.chaincollector.unit.support.MutableClock;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResilientCallTest {

    private BreakerRegistry registry;
    private ResilientCall resilientCall;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atIst(2025, 6, 11, 10, 0);
        registry = new BreakerRegistry(
                BreakerConfig.builder().failureThreshold(2).jitter(0.0).build(), clock, new Random(2));
        RetryPolicy retry = new RetryPolicy(
                RetrySettings.builder()
                        .maxAttempts(4)
                        .backoffBase(Duration.ofMillis(1))
                        .backoffCap(Duration.ofMillis(1))
                        .jitter(false)
                        .build(),
                clock,
                new Random(2));
        resilientCall = ResilientCall.of(registry, retry);
    }

    @Test
    @DisplayName("Retries inside the breaker count as one successful call")
    void retriesAreInvisibleToBreaker() {
        AtomicInteger calls = new AtomicInteger();

        Integer value = resilientCall.call("kite.quote", () -> {
            if (calls.incrementAndGet() <= 3) {
                throw new ProviderException("reset", new ConnectException("refused"), true);
            }
            return 42;
        });

        assertThat(value).isEqualTo(42);
        assertThat(calls).hasValue(4);
        assertThat(registry.get("kite.quote").getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.get("kite.quote").getFailures()).isZero();
    }

    @Test
    @DisplayName("Exhausted retries count once against the breaker")
    void exhaustionCountsOnce() {
        assertThatThrownBy(() -> resilientCall.call("kite.ltp", () -> {
            throw new ProviderException("reset", new ConnectException("refused"), true);
        })).isInstanceOf(RetryExhaustedException.class);

        assertThat(registry.get("kite.ltp").getFailures()).isEqualTo(1);
        assertThat(registry.get("kite.ltp").getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("An open breaker rejects without invoking the call")
    void openBreakerShortCircuits() {
        registry.get("kite.ohlc").recordFailure(new ProviderException("a"));
        registry.get("kite.ohlc").recordFailure(new ProviderException("b"));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> resilientCall.call("kite.ohlc", calls::incrementAndGet))
                .isInstanceOf(CircuitOpenException.class);
        assertThat(calls).hasValue(0);
    }
}
