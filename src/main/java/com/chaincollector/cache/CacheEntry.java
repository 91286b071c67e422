package com.chaincollector.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import lombok.Value;

/**
 * A cached value and the instant it was fetched. Entries are replaced wholesale, never mutated.
 *
 * <p>An empty collection value is treated as fresh only for the short empty TTL, so an empty
 * upstream answer is re-queried much sooner than a real one.
 */
@Value
public class CacheEntry<T extends Collection<?>> {

    T value;
    Instant fetchedAt;

    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }

    public boolean isFresh(Instant now, Duration ttl, Duration shortEmptyTtl) {
        Duration effective = isEmpty() ? shortEmptyTtl : ttl;
        return Duration.between(fetchedAt, now).compareTo(effective) < 0;
    }
}
