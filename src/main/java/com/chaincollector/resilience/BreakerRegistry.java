package com.chaincollector.resilience;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.random.RandomGenerator;

/**
 * Registry of named {@link AdaptiveCircuitBreaker}s.
 *
 * <p>One instance is created at startup and injected wherever breakers are needed; tests build
 * their own. Breakers are created lazily on first lookup and live for the registry's lifetime.
 * Each breaker has its own lock, so different names never contend.
 */
public class BreakerRegistry {

    private final BreakerConfig defaultConfig;
    private final Clock clock;
    private final RandomGenerator random;
    private final BreakerStateStore stateStore;
    private final Map<String, AdaptiveCircuitBreaker> breakers = new ConcurrentHashMap<>();

    public BreakerRegistry(BreakerConfig defaultConfig, Clock clock, RandomGenerator random) {
        this(defaultConfig, clock, random, null);
    }

    public BreakerRegistry(
            BreakerConfig defaultConfig, Clock clock, RandomGenerator random, BreakerStateStore stateStore) {
        this.defaultConfig = defaultConfig;
        this.clock = clock;
        this.random = random;
        this.stateStore = stateStore;
    }

    public AdaptiveCircuitBreaker get(String name) {
        return get(name, defaultConfig);
    }

    /** Returns the named breaker, creating it with {@code config} if absent. */
    public AdaptiveCircuitBreaker get(String name, BreakerConfig config) {
        return breakers.computeIfAbsent(
                name, n -> new AdaptiveCircuitBreaker(n, config, clock, random, stateStore));
    }

    public boolean contains(String name) {
        return breakers.containsKey(name);
    }

    /** Snapshot of every registered breaker, sorted by name. */
    public Map<String, BreakerSnapshot> snapshot() {
        Map<String, BreakerSnapshot> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.snapshot()));
        return result;
    }

    public int size() {
        return breakers.size();
    }

    /** Drops all breakers; the next lookup starts CLOSED (or from persisted state). */
    public void reset() {
        breakers.clear();
    }

    public BreakerConfig getDefaultConfig() {
        return defaultConfig;
    }
}
