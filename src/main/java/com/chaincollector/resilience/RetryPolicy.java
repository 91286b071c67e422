package com.chaincollector.resilience;

import com.chaincollector.exception.CircuitOpenException;
import com.chaincollector.exception.ProviderException;
import com.chaincollector.exception.RetryExhaustedException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, classified retries built on a resilience4j {@link Retry}.
 *
 * <p>A call is attempted up to {@code maxAttempts} times, and no new attempt starts once
 * {@code maxElapsed} has passed since the first. Between attempts the wait is
 * {@code min(cap, base * 2^(attempt-1))} plus, when jitter is on, a uniform extra in
 * {@code [0, base)}.
 *
 * <p>Outcome:
 * <ul>
 *   <li>success on any attempt: the value is returned</li>
 *   <li>a non-retryable failure: rethrown unchanged, no further attempts</li>
 *   <li>a retryable failure on the last allowed attempt: {@link RetryExhaustedException}
 *       wrapping it</li>
 * </ul>
 *
 * <p>{@link CircuitOpenException} is never retried.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private static final List<Class<? extends Throwable>> DEFAULT_RETRYABLE = List.of(
            SocketTimeoutException.class,
            ConnectException.class,
            TimeoutException.class,
            HttpTimeoutException.class,
            RequestNotPermitted.class);

    private final RetrySettings settings;
    private final Clock clock;
    private final RandomGenerator random;

    public RetryPolicy(RetrySettings settings, Clock clock, RandomGenerator random) {
        this.settings = settings;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Runs {@code call} with retries.
     *
     * @param operation name used for logging and the exhaustion message
     */
    public <T> T execute(String operation, Supplier<T> call) {
        Instant started = clock.instant();
        AtomicInteger attempts = new AtomicInteger();

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                .intervalFunction(backoff(started))
                .retryOnException(e -> isRetryable(e) && withinBudget(started))
                .build();
        Retry retry = Retry.of(operation, retryConfig);

        Supplier<T> decorated = Retry.decorateSupplier(retry, () -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                log.debug("Retrying {} (attempt {}/{})", operation, attempt, settings.getMaxAttempts());
            }
            return call.get();
        });

        try {
            return decorated.get();
        } catch (RuntimeException e) {
            if (isRetryable(e)) {
                log.warn("Retries exhausted for {} after {} attempt(s): {}", operation, attempts.get(), e.toString());
                throw new RetryExhaustedException(operation, attempts.get(), e);
            }
            throw e;
        }
    }

    /**
     * Classifies a failure: blacklist first, then whitelist, then the default timeout and
     * connection kinds anywhere in the cause chain.
     */
    public boolean isRetryable(Throwable error) {
        if (error instanceof CircuitOpenException) {
            return false;
        }
        if (matchesAny(error, settings.getBlacklist())) {
            return false;
        }
        if (!settings.getWhitelist().isEmpty()) {
            return matchesAny(error, settings.getWhitelist());
        }
        return isTransient(error);
    }

    /** Wait before attempt {@code attempt + 1}, without the random part. */
    public Duration baseDelay(int attempt) {
        double baseMs = settings.getBackoffBase().toMillis();
        double delay = baseMs * Math.pow(2, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.round(Math.min(delay, settings.getBackoffCap().toMillis())));
    }

    public RetrySettings getSettings() {
        return settings;
    }

    // ---- Private helpers ----

    private IntervalFunction backoff(Instant started) {
        return attempt -> {
            long wait = baseDelay(attempt).toMillis();
            long baseMs = settings.getBackoffBase().toMillis();
            if (settings.isJitter() && baseMs > 0) {
                wait += (long) (random.nextDouble() * baseMs);
            }
            long remaining = settings.getMaxElapsed().toMillis()
                    - Duration.between(started, clock.instant()).toMillis();
            return Math.max(0L, Math.min(wait, Math.max(0L, remaining)));
        };
    }

    private boolean withinBudget(Instant started) {
        return Duration.between(started, clock.instant()).compareTo(settings.getMaxElapsed()) < 0;
    }

    private static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof ProviderException && ((ProviderException) current).isTransientFailure()) {
                return true;
            }
            for (Class<? extends Throwable> kind : DEFAULT_RETRYABLE) {
                if (kind.isInstance(current)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean matchesAny(Throwable error, List<Class<? extends Throwable>> kinds) {
        for (Class<? extends Throwable> kind : kinds) {
            if (kind.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
