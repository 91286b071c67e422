package com.chaincollector.memory;

/**
 * Source of raw memory usage samples.
 */
@FunctionalInterface
public interface MemorySampler {

    /** Resident memory of this process as a fraction of physical memory, in [0, 1]. */
    double sampleFraction();
}
