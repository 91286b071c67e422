package com.chaincollector.cache;

/**
 * A cache that can drop its contents when memory pressure asks for it.
 */
public interface Purgeable {

    /** Drops cached entries; returns how many were removed. */
    int purge();

    String getCacheName();
}
