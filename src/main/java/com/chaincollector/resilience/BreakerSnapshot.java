package com.chaincollector.resilience;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time view of a breaker. Also the on-disk format used by {@link BreakerStateStore}.
 */
@Value
@Builder
@Jacksonized
public class BreakerSnapshot {

    String name;
    CircuitState state;
    int failures;
    Instant openedAt;
    double currentTimeoutSeconds;
    List<String> recentErrors;
    Instant savedAt;
}
