package com.chaincollector.exception;

import java.time.Duration;
import java.util.Map;
import lombok.Getter;

/**
 * Raised when a named circuit breaker rejects a call. Never retried by the immediate caller.
 */
@Getter
public class CircuitOpenException extends BaseException {

    private final String breakerName;
    private final Duration retryAfter;

    public CircuitOpenException(String breakerName, Duration retryAfter) {
        super(
                ErrorCode.CIRCUIT_OPEN,
                "Circuit '" + breakerName + "' is open; retry after " + retryAfter.toMillis() + " ms",
                Map.of("breaker", breakerName, "retryAfterMs", retryAfter.toMillis()));
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }
}
