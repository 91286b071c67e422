package com.chaincollector.memory;

/**
 * Degradation steps a pressure tier can switch on.
 */
public enum PressureAction {
    /** Purge registered caches when entering the tier. */
    SHRINK_CACHE,
    /** Collect fewer strikes around the ATM (see depth scale). */
    REDUCE_DEPTH,
    /** Skip Greeks/IV computation for collected options. */
    SKIP_GREEKS,
    /** Run collection cycles less often. */
    SLOW_CYCLES,
    /** Stop emitting per-option metrics. */
    DROP_PER_OPTION_METRICS
}
