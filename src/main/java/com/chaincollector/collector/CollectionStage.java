package com.chaincollector.collector;

/**
 * Steps of one index task, in execution order.
 */
public enum CollectionStage {
    INDEX_DATA,
    RESOLVE_EXPIRY,
    STRIKES,
    INSTRUMENTS,
    ENRICHMENT,
    GREEKS,
    SINK_WRITE,
    OVERVIEW,
    /** The whole index task; used for timeouts and crashes. */
    TASK
}
