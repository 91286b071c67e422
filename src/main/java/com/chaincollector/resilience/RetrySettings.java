package com.chaincollector.resilience;

import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Knobs for {@link RetryPolicy}.
 *
 * <p>Classification order: {@code blacklist} always forbids a retry; otherwise a non-empty
 * {@code whitelist} restricts retries to the listed types; otherwise only timeout and
 * connection failures are retried. Subclasses of a listed type match.
 */
@Value
@Builder(toBuilder = true)
public class RetrySettings {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration maxElapsed = Duration.ofSeconds(8);

    @Builder.Default
    Duration backoffBase = Duration.ofMillis(200);

    @Builder.Default
    Duration backoffCap = Duration.ofMillis(2500);

    @Builder.Default
    boolean jitter = true;

    @Singular("whitelisted")
    List<Class<? extends Throwable>> whitelist;

    @Singular("blacklisted")
    List<Class<? extends Throwable>> blacklist;

    public static RetrySettings defaults() {
        return RetrySettings.builder().build();
    }
}
