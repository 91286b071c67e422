package com.chaincollector.memory;

import java.util.List;
import java.util.Set;
import lombok.Value;

/**
 * One memory-pressure tier. {@code threshold} is the EMA-smoothed fraction of physical memory
 * at or above which the tier applies.
 */
@Value
public class PressureTier {

    String name;
    int level;
    double threshold;
    Set<PressureAction> actions;

    public boolean has(PressureAction action) {
        return actions.contains(action);
    }

    public static List<PressureTier> defaults() {
        return List.of(
                new PressureTier("normal", 0, 0.0, Set.of()),
                new PressureTier("elevated", 1, 0.70, Set.of(PressureAction.SHRINK_CACHE)),
                new PressureTier(
                        "high",
                        2,
                        0.80,
                        Set.of(
                                PressureAction.SHRINK_CACHE,
                                PressureAction.REDUCE_DEPTH,
                                PressureAction.SKIP_GREEKS,
                                PressureAction.SLOW_CYCLES)),
                new PressureTier(
                        "critical",
                        3,
                        0.90,
                        Set.of(
                                PressureAction.SHRINK_CACHE,
                                PressureAction.REDUCE_DEPTH,
                                PressureAction.SKIP_GREEKS,
                                PressureAction.SLOW_CYCLES,
                                PressureAction.DROP_PER_OPTION_METRICS)));
    }
}
