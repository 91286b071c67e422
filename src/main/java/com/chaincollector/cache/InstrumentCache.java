package com.chaincollector.cache;

import com.chaincollector.domain.model.Instrument;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-exchange TTL cache of instrument universes.
 *
 * <p>Lookup rules for {@link #getOrFetch}:
 * <ul>
 *   <li>a non-empty entry younger than {@code ttl} is a hit</li>
 *   <li>an empty entry is a hit only while younger than {@code shortEmptyTtl}</li>
 *   <li>{@code forceRefresh} always fetches</li>
 *   <li>an empty fetch result is retried once through {@code retryFetch} when one is supplied</li>
 *   <li>a failing fetch is logged and cached as an empty entry back-dated to
 *       {@code now - (ttl - 10s)}, so the next lookup refetches instead of waiting a full TTL</li>
 * </ul>
 *
 * <p>The fetch itself runs without any lock held. Two concurrent misses on the same exchange may
 * both fetch; the later result replaces the earlier one.
 */
public class InstrumentCache implements Purgeable {

    private static final Logger log = LoggerFactory.getLogger(InstrumentCache.class);

    static final Duration FAILURE_HEADROOM = Duration.ofSeconds(10);

    private final Clock clock;
    private final Map<String, CacheEntry<List<Instrument>>> entries = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();

    public InstrumentCache(Clock clock) {
        this.clock = clock;
    }

    public InstrumentFetchResult getOrFetch(String exchange, Supplier<List<Instrument>> fetch) {
        return getOrFetch(exchange, fetch, FetchOptions.defaults());
    }

    /**
     * Returns the cached universe for {@code exchange}, fetching it when missing or stale.
     * Never throws because of {@code fetch}.
     */
    public InstrumentFetchResult getOrFetch(
            String exchange, Supplier<List<Instrument>> fetch, FetchOptions options) {
        String key = normalize(exchange);
        Instant now = clock.instant();

        if (!options.isForceRefresh()) {
            CacheEntry<List<Instrument>> cached = entries.get(key);
            if (cached != null && cached.isFresh(now, options.getTtl(), options.getShortEmptyTtl())) {
                hits.incrementAndGet();
                log.debug("Instrument cache hit for {} ({} instruments)", key, cached.getValue().size());
                return new InstrumentFetchResult(cached.getValue(), true);
            }
        }

        misses.incrementAndGet();
        List<Instrument> fetched;
        Instant fetchedAt;
        try {
            fetched = orEmpty(fetch.get());
            if (fetched.isEmpty() && options.isRetryOnEmpty() && options.getRetryFetch() != null) {
                log.info("Empty instrument universe for {}, retrying once", key);
                fetched = orEmpty(options.getRetryFetch().get());
            }
            fetchedAt = clock.instant();
        } catch (RuntimeException e) {
            fetchFailures.incrementAndGet();
            log.warn("Instrument fetch for {} failed, caching empty result briefly: {}", key, e.getMessage());
            fetched = List.of();
            fetchedAt = backdatedForRetry(clock.instant(), options.getTtl());
        }

        entries.put(key, new CacheEntry<>(fetched, fetchedAt));
        if (fetched.isEmpty()) {
            log.warn("Instrument universe for {} is empty", key);
        } else {
            log.info("Cached {} instruments for {}", fetched.size(), key);
        }
        return new InstrumentFetchResult(fetched, false);
    }

    public Optional<CacheEntry<List<Instrument>>> peek(String exchange) {
        return Optional.ofNullable(entries.get(normalize(exchange)));
    }

    public void invalidate(String exchange) {
        entries.remove(normalize(exchange));
    }

    @Override
    public int purge() {
        int removed = entries.size();
        entries.clear();
        if (removed > 0) {
            log.info("Purged {} instrument universe(s)", removed);
        }
        return removed;
    }

    @Override
    public String getCacheName() {
        return "instruments";
    }

    public int size() {
        return entries.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getFetchFailures() {
        return fetchFailures.get();
    }

    // ---- Private helpers ----

    private static Instant backdatedForRetry(Instant now, Duration ttl) {
        Duration age = ttl.compareTo(FAILURE_HEADROOM) > 0 ? ttl.minus(FAILURE_HEADROOM) : ttl;
        return now.minus(age);
    }

    private static List<Instrument> orEmpty(List<Instrument> instruments) {
        return instruments == null ? List.of() : List.copyOf(instruments);
    }

    private static String normalize(String exchange) {
        return exchange == null ? "" : exchange.trim().toUpperCase();
    }
}
