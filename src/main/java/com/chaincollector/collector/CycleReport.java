package com.chaincollector.collector;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of one collection cycle. Outcomes are keyed by index in launch order.
 */
@Value
@Builder
public class CycleReport {

    long cycleId;
    Instant startedAt;
    Duration elapsed;
    Map<String, IndexCollectionOutcome> outcomes;
    int pressureLevel;

    public long count(CollectionStatus status) {
        return outcomes.values().stream().filter(o -> o.getStatus() == status).count();
    }

    public int totalOptionsWritten() {
        return outcomes.values().stream().mapToInt(IndexCollectionOutcome::getOptionsWritten).sum();
    }

    public IndexCollectionOutcome outcome(String index) {
        return outcomes.get(index);
    }
}
