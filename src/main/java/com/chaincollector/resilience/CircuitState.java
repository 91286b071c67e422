package com.chaincollector.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
