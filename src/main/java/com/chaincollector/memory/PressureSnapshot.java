package com.chaincollector.memory;

import lombok.Builder;
import lombok.Value;

/**
 * Degradation guidance taken once per cycle and handed to every collection task, so all tasks
 * of a cycle see the same tier.
 */
@Value
@Builder
public class PressureSnapshot {

    int level;
    String tierName;
    double ema;
    double depthScale;
    boolean reduceDepth;
    boolean skipGreeks;
    boolean slowCycles;
    boolean dropPerOptionMetrics;
    boolean downgradePending;

    /** Strikes each side of ATM that still get per-option metrics. */
    int metricStrikeWindow;

    public static PressureSnapshot normal() {
        return PressureSnapshot.builder()
                .level(0)
                .tierName("normal")
                .depthScale(1.0)
                .metricStrikeWindow(Integer.MAX_VALUE)
                .build();
    }

    /** Strike-count multiplier to apply, or 1.0 when depth reduction is off. */
    public double effectiveDepthScale() {
        return reduceDepth ? depthScale : 1.0;
    }
}
