package com.chaincollector.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;
import lombok.With;

/**
 * Explicit logging and error context carried through a collection cycle: which cycle, which
 * index, which component is acting.
 */
@Value
@With
public class CycleContext {

    long cycleId;
    String index;
    String component;

    public static CycleContext forCycle(long cycleId) {
        return new CycleContext(cycleId, null, "collector");
    }

    /** MDC-ready view; null fields are left out. */
    public Map<String, String> asMdc() {
        Map<String, String> mdc = new LinkedHashMap<>();
        mdc.put("cycle", String.valueOf(cycleId));
        if (index != null) {
            mdc.put("index", index);
        }
        if (component != null) {
            mdc.put("component", component);
        }
        return mdc;
    }
}
