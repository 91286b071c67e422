package com.chaincollector.collector;

/**
 * Final state of one index task within a cycle.
 */
public enum CollectionStatus {
    /** Every configured expiry rule was written. */
    COLLECTED,
    /** At least one rule written, at least one stage failed. */
    PARTIAL,
    MARKET_CLOSED,
    INDEX_DATA_FAILED,
    /** All rules failed before the sink write; placeholder structure ensured. */
    NOTHING_WRITTEN,
    TIMED_OUT,
    /** The task crashed outside the stage handling. */
    FAILED;

    public boolean wroteData() {
        return this == COLLECTED || this == PARTIAL;
    }
}
