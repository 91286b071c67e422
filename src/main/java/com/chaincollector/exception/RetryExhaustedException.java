package com.chaincollector.exception;

import lombok.Getter;

/**
 * Aggregated failure after all retry attempts were used (or the elapsed-time budget ran out).
 * The cause is the exception thrown by the last attempt.
 */
@Getter
public class RetryExhaustedException extends BaseException {

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(
                ErrorCode.RETRY_EXHAUSTED,
                "Retries exhausted for " + operation + " after " + attempts + " attempt(s): "
                        + lastFailure.getMessage(),
                lastFailure);
        this.attempts = attempts;
    }
}
