package com.chaincollector.resilience;

import com.chaincollector.exception.CircuitOpenException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker whose open-state timeout adapts to both the consecutive failure count and
 * how densely failures cluster in time.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED: every call is admitted. A success decrements the failure count, a failure
 *       increments it; reaching {@code failureThreshold} trips the circuit.</li>
 *   <li>OPEN: calls are rejected until the adaptive timeout has elapsed since the trip, then the
 *       breaker moves to HALF_OPEN.</li>
 *   <li>HALF_OPEN: exactly one probe call is in flight at a time. A successful probe closes the
 *       circuit (after {@code halfOpenSuccesses} probes); a failed probe re-opens it.</li>
 * </ul>
 *
 * <p>On trip the timeout is
 * {@code clamp(min * factor^(failures-1) * (1 + min(3, failuresPerMinute/10)), min, max)} with
 * +/- {@code jitter} applied, where failuresPerMinute counts failures in the last 60 seconds.
 *
 * <p>State transitions are serialized by a per-breaker {@link ReentrantLock}. The CLOSED check in
 * {@link #allow()} is a lock-free volatile read. No lock is held while the protected call runs.
 */
public class AdaptiveCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveCircuitBreaker.class);

    static final Duration FAILURE_WINDOW = Duration.ofSeconds(60);
    static final int RECENT_ERRORS_KEPT = 20;

    private final String name;
    private final BreakerConfig config;
    private final Clock clock;
    private final RandomGenerator random;
    private final BreakerStateStore stateStore;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> failureTimestamps = new ArrayDeque<>();
    private final Deque<String> recentErrors = new ArrayDeque<>();

    private volatile CircuitState state = CircuitState.CLOSED;
    private int failures;
    private int halfOpenSuccessCount;
    private boolean probeInFlight;
    private Instant openedAt;
    private Duration currentTimeout;

    public AdaptiveCircuitBreaker(String name, BreakerConfig config, Clock clock, RandomGenerator random) {
        this(name, config, clock, random, null);
    }

    public AdaptiveCircuitBreaker(
            String name, BreakerConfig config, Clock clock, RandomGenerator random, BreakerStateStore stateStore) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.random = random;
        this.stateStore = stateStore;
        this.currentTimeout = floorTimeout();
        if (stateStore != null) {
            stateStore.load(name).ifPresent(this::restore);
        }
    }

    /**
     * Reports whether a call may proceed. In HALF_OPEN this admits one probe and marks it in
     * flight, so the caller must follow up with {@link #recordSuccess()} or
     * {@link #recordFailure(Throwable)}.
     */
    public boolean allow() {
        if (state == CircuitState.CLOSED) {
            return true;
        }
        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                if (elapsedSinceOpen().compareTo(currentTimeout) < 0) {
                    return false;
                }
                transitionTo(CircuitState.HALF_OPEN);
                halfOpenSuccessCount = 0;
                probeInFlight = false;
            }
            if (state == CircuitState.HALF_OPEN) {
                if (probeInFlight) {
                    return false;
                }
                probeInFlight = true;
                return true;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                probeInFlight = false;
                halfOpenSuccessCount++;
                if (halfOpenSuccessCount >= config.getHalfOpenSuccesses()) {
                    failures = 0;
                    openedAt = null;
                    currentTimeout = floorTimeout();
                    transitionTo(CircuitState.CLOSED);
                    persist();
                }
            } else if (failures > 0) {
                failures--;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure(Throwable error) {
        lock.lock();
        try {
            Instant now = clock.instant();
            failureTimestamps.addLast(now);
            pruneWindow(now);
            failures++;
            recentErrors.addLast(describe(error));
            while (recentErrors.size() > RECENT_ERRORS_KEPT) {
                recentErrors.removeFirst();
            }
            // an OPEN breaker keeps its deadline; late failures only count
            if (state == CircuitState.HALF_OPEN
                    || (state == CircuitState.CLOSED && failures >= config.getFailureThreshold())) {
                probeInFlight = false;
                trip(now);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code call} through the breaker.
     *
     * @throws CircuitOpenException if the breaker rejects the call; carries the remaining wait
     */
    public <T> T execute(Supplier<T> call) {
        if (!allow()) {
            throw new CircuitOpenException(name, remainingOpenTime());
        }
        T result;
        try {
            result = call.get();
        } catch (RuntimeException | Error e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    /** Time left before an OPEN breaker will admit a probe; zero in any other state. */
    public Duration remainingOpenTime() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN || openedAt == null) {
                return Duration.ZERO;
            }
            Duration remaining = currentTimeout.minus(elapsedSinceOpen());
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } finally {
            lock.unlock();
        }
    }

    public BreakerSnapshot snapshot() {
        lock.lock();
        try {
            return BreakerSnapshot.builder()
                    .name(name)
                    .state(state)
                    .failures(failures)
                    .openedAt(openedAt)
                    .currentTimeoutSeconds(currentTimeout.toMillis() / 1000.0)
                    .recentErrors(new ArrayList<>(recentErrors))
                    .savedAt(clock.instant())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }

    public int getFailures() {
        lock.lock();
        try {
            return failures;
        } finally {
            lock.unlock();
        }
    }

    public Duration getCurrentTimeout() {
        lock.lock();
        try {
            return currentTimeout;
        } finally {
            lock.unlock();
        }
    }

    /** Number of failures recorded in the last 60 seconds. */
    public int getFailuresPerMinute() {
        lock.lock();
        try {
            pruneWindow(clock.instant());
            return failureTimestamps.size();
        } finally {
            lock.unlock();
        }
    }

    // ---- Private helpers ----

    private void trip(Instant now) {
        double minSeconds = Math.max(1.0, seconds(config.getMinResetTimeout()));
        double maxSeconds = seconds(config.getMaxResetTimeout());
        double base = minSeconds * Math.pow(config.getBackoffFactor(), Math.max(0, failures - 1));
        double amplifier = 1.0 + Math.min(3.0, failureTimestamps.size() / 10.0);
        double timeout = Math.min(base * amplifier, maxSeconds);
        if (config.getJitter() > 0) {
            timeout = timeout * (1.0 + (random.nextDouble() - 0.5) * 2.0 * config.getJitter());
        }
        timeout = Math.max(seconds(config.getMinResetTimeout()), Math.min(timeout, maxSeconds));

        currentTimeout = Duration.ofMillis(Math.round(timeout * 1000));
        openedAt = now;
        transitionTo(CircuitState.OPEN);
        log.warn(
                "Circuit '{}' opened after {} failure(s), {} in the last minute; reset timeout {} ms",
                name,
                failures,
                failureTimestamps.size(),
                currentTimeout.toMillis());
        persist();
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (previous != next) {
            log.info("Circuit '{}' transition: {} -> {}", name, previous, next);
        }
    }

    private void pruneWindow(Instant now) {
        Instant cutoff = now.minus(FAILURE_WINDOW);
        while (!failureTimestamps.isEmpty() && failureTimestamps.peekFirst().isBefore(cutoff)) {
            failureTimestamps.removeFirst();
        }
    }

    private Duration elapsedSinceOpen() {
        if (openedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(openedAt, clock.instant());
    }

    private Duration floorTimeout() {
        Duration min = config.getMinResetTimeout();
        return min.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : min;
    }

    private void persist() {
        if (stateStore != null) {
            stateStore.save(snapshot());
        }
    }

    private void restore(BreakerSnapshot saved) {
        state = saved.getState() != null ? saved.getState() : CircuitState.CLOSED;
        failures = Math.max(0, saved.getFailures());
        openedAt = saved.getOpenedAt();
        if (saved.getCurrentTimeoutSeconds() > 0) {
            currentTimeout = Duration.ofMillis(Math.round(saved.getCurrentTimeoutSeconds() * 1000));
        }
        List<String> errors = saved.getRecentErrors() != null ? saved.getRecentErrors() : List.of();
        errors.stream().skip(Math.max(0, errors.size() - RECENT_ERRORS_KEPT)).forEach(recentErrors::addLast);
        if (state == CircuitState.HALF_OPEN) {
            // a probe from the previous process can never report back
            state = CircuitState.OPEN;
        }
        if (state == CircuitState.OPEN && openedAt == null) {
            openedAt = clock.instant();
        }
        log.info("Restored circuit '{}' in state {} with {} failure(s)", name, state, failures);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
