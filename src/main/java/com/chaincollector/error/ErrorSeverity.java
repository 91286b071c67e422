package com.chaincollector.error;

public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(ErrorSeverity other) {
        return compareTo(other) >= 0;
    }
}
