package com.chaincollector.resilience;

import java.util.function.Supplier;

/**
 * Composes {@link RetryPolicy} inside a named {@link AdaptiveCircuitBreaker}.
 *
 * <p>The breaker sees the retried call as a single unit, so it records one success or one
 * failure per outer call no matter how many attempts ran inside. A rejected call surfaces as
 * {@link com.chaincollector.exception.CircuitOpenException} without touching the retry loop.
 */
public class ResilientCall {

    private final BreakerRegistry breakerRegistry;
    private final RetryPolicy retryPolicy;

    public ResilientCall(BreakerRegistry breakerRegistry, RetryPolicy retryPolicy) {
        this.breakerRegistry = breakerRegistry;
        this.retryPolicy = retryPolicy;
    }

    public static ResilientCall of(BreakerRegistry breakerRegistry, RetryPolicy retryPolicy) {
        return new ResilientCall(breakerRegistry, retryPolicy);
    }

    public <T> T call(String breakerName, Supplier<T> call) {
        AdaptiveCircuitBreaker breaker = breakerRegistry.get(breakerName);
        return breaker.execute(() -> retryPolicy.execute(breakerName, call));
    }

    public BreakerRegistry getBreakerRegistry() {
        return breakerRegistry;
    }
}
