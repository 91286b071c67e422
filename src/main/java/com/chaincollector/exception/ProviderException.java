package com.chaincollector.exception;

import lombok.Getter;

/**
 * Failure of an upstream market-data call. Kite SDK exceptions, JSON parse failures and
 * transport errors are wrapped into this type at the provider boundary.
 *
 * <p>{@code transientFailure} marks failures worth retrying (timeouts, connection resets,
 * HTTP 5xx/429 from the broker).
 */
@Getter
public class ProviderException extends BaseException {

    private final boolean transientFailure;

    public ProviderException(String message) {
        super(ErrorCode.PROVIDER_ERROR, message);
        this.transientFailure = false;
    }

    public ProviderException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_ERROR, message, cause);
        this.transientFailure = false;
    }

    public ProviderException(String message, Throwable cause, boolean transientFailure) {
        super(ErrorCode.PROVIDER_ERROR, message, cause);
        this.transientFailure = transientFailure;
    }
}
