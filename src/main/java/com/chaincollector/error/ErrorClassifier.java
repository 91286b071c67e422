package com.chaincollector.error;

import com.chaincollector.exception.CircuitOpenException;
import com.chaincollector.exception.CollectionException;
import com.chaincollector.exception.CredentialsException;
import com.chaincollector.exception.ProviderException;
import com.chaincollector.exception.RetryExhaustedException;
import com.chaincollector.exception.SinkWriteException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;
import lombok.Value;

/**
 * Default category and severity for an exception when the caller does not specify them.
 */
public class ErrorClassifier {

    @Value
    public static class Classification {
        ErrorCategory category;
        ErrorSeverity severity;
    }

    public Classification classify(Throwable error) {
        if (error instanceof OutOfMemoryError) {
            return of(ErrorCategory.MEMORY, ErrorSeverity.CRITICAL);
        }
        if (error instanceof CredentialsException) {
            return of(ErrorCategory.CONFIGURATION, ErrorSeverity.CRITICAL);
        }
        if (error instanceof SinkWriteException) {
            return of(ErrorCategory.CSV_WRITE, ErrorSeverity.MEDIUM);
        }
        if (error instanceof CollectionException) {
            return of(ErrorCategory.DATA_COLLECTION, ErrorSeverity.MEDIUM);
        }
        if (error instanceof CircuitOpenException) {
            return of(ErrorCategory.PROVIDER_API, ErrorSeverity.MEDIUM);
        }
        if (error instanceof RetryExhaustedException) {
            return classifyCause(error.getCause(), of(ErrorCategory.PROVIDER_API, ErrorSeverity.HIGH));
        }
        if (isNetwork(error)) {
            return of(ErrorCategory.NETWORK, ErrorSeverity.MEDIUM);
        }
        if (error instanceof ProviderException) {
            return of(ErrorCategory.PROVIDER_API, ErrorSeverity.HIGH);
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return of(ErrorCategory.FILE_IO, ErrorSeverity.MEDIUM);
        }
        if (error instanceof IllegalArgumentException) {
            return of(ErrorCategory.DATA_VALIDATION, ErrorSeverity.MEDIUM);
        }
        if (error instanceof ArithmeticException) {
            return of(ErrorCategory.CALCULATION, ErrorSeverity.MEDIUM);
        }
        return of(ErrorCategory.UNKNOWN, ErrorSeverity.MEDIUM);
    }

    private Classification classifyCause(Throwable cause, Classification fallback) {
        if (cause != null && isNetwork(cause)) {
            return of(ErrorCategory.NETWORK, ErrorSeverity.HIGH);
        }
        return fallback;
    }

    private static boolean isNetwork(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static Classification of(ErrorCategory category, ErrorSeverity severity) {
        return new Classification(category, severity);
    }
}
