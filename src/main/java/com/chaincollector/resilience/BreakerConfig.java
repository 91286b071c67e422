package com.chaincollector.resilience;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Tuning knobs for an {@link AdaptiveCircuitBreaker}.
 *
 * <p>The open-state timeout grows geometrically with consecutive failures
 * ({@code minResetTimeout * backoffFactor^(failures-1)}), is amplified when failures cluster
 * inside the 60 second window, and is capped at {@code maxResetTimeout}.
 */
@Value
@Builder(toBuilder = true)
public class BreakerConfig {

    @Builder.Default
    int failureThreshold = 5;

    @Builder.Default
    Duration minResetTimeout = Duration.ofSeconds(10);

    @Builder.Default
    Duration maxResetTimeout = Duration.ofSeconds(300);

    @Builder.Default
    double backoffFactor = 2.0;

    /** Fractional jitter applied to each computed timeout, e.g. 0.2 for +/-20%. */
    @Builder.Default
    double jitter = 0.2;

    /** Successful probes needed in HALF_OPEN before the circuit closes. */
    @Builder.Default
    int halfOpenSuccesses = 1;

    public static BreakerConfig defaults() {
        return BreakerConfig.builder().build();
    }
}
