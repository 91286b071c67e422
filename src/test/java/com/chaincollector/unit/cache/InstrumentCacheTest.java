package com.chaincollector.unit.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.chaincollector.cache.FetchOptions;
import com.chaincollector.cache.InstrumentCache;
import com.chaincollector.cache.InstrumentFetchResult;
import com.chaincollector.domain.model.Instrument;
import com.chaincollector.unit.support.Fixtures;
import com.chaincollector.unit.support.MutableClock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for InstrumentCache freshness rules, covering the short TTL for empty universes and
 * the handling of failed fetches.
 */
class InstrumentCacheTest {

    private static final LocalDate EXPIRY = LocalDate.of(2025, 6, 26);
    private static final List<Instrument> UNIVERSE = Fixtures.chain("NIFTY", EXPIRY, 24700, 24900, 50);

    private MutableClock clock;
    private InstrumentCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atIst(2025, 6, 11, 10, 0);
        cache = new InstrumentCache(clock);
    }

    private static Supplier<List<Instrument>> counting(AtomicInteger calls, List<Instrument> result) {
        return () -> {
            calls.incrementAndGet();
            return result;
        };
    }

    @Nested
    @DisplayName("Non-empty universes")
    class NonEmpty {

        @Test
        @DisplayName("Served from cache until the TTL expires")
        void cachedForTtl() {
            AtomicInteger calls = new AtomicInteger();

            InstrumentFetchResult first = cache.getOrFetch("nfo", counting(calls, UNIVERSE));
            clock.advance(Duration.ofSeconds(599));
            InstrumentFetchResult second = cache.getOrFetch("NFO", counting(calls, UNIVERSE));

            assertThat(first.isFromCache()).isFalse();
            assertThat(second.isFromCache()).isTrue();
            assertThat(second.getInstruments()).hasSize(UNIVERSE.size());
            assertThat(calls).hasValue(1);

            clock.advance(Duration.ofSeconds(1));
            cache.getOrFetch("NFO", counting(calls, UNIVERSE));
            assertThat(calls).hasValue(2);
            assertThat(cache.getHits()).isEqualTo(1);
            assertThat(cache.getMisses()).isEqualTo(2);
        }

        @Test
        @DisplayName("forceRefresh skips a fresh entry")
        void forceRefresh() {
            AtomicInteger calls = new AtomicInteger();
            cache.getOrFetch("NFO", counting(calls, UNIVERSE));

            cache.getOrFetch("NFO", counting(calls, UNIVERSE), FetchOptions.builder().forceRefresh(true).build());

            assertThat(calls).hasValue(2);
        }
    }

    @Nested
    @DisplayName("Empty universes")
    class Empty {

        @Test
        @DisplayName("An empty entry is re-queried once the short TTL passes")
        void shortEmptyTtl() {
            AtomicInteger calls = new AtomicInteger();
            FetchOptions options = FetchOptions.builder().shortEmptyTtl(Duration.ofSeconds(5)).build();

            cache.getOrFetch("NFO", counting(calls, List.of()), options);
            clock.advance(Duration.ofSeconds(4));
            InstrumentFetchResult stillEmpty = cache.getOrFetch("NFO", counting(calls, List.of()), options);
            clock.advance(Duration.ofSeconds(1));
            InstrumentFetchResult refreshed = cache.getOrFetch("NFO", counting(calls, UNIVERSE), options);

            assertThat(stillEmpty.isFromCache()).isTrue();
            assertThat(refreshed.isFromCache()).isFalse();
            assertThat(refreshed.getInstruments()).isNotEmpty();
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("A non-empty retry result replaces an empty primary fetch")
        void retryOnEmpty() {
            AtomicInteger retries = new AtomicInteger();
            FetchOptions options = FetchOptions.builder().retryFetch(counting(retries, UNIVERSE)).build();

            InstrumentFetchResult result = cache.getOrFetch("NFO", List::of, options);

            assertThat(result.getInstruments()).hasSize(UNIVERSE.size());
            assertThat(retries).hasValue(1);
            assertThat(cache.peek("NFO")).hasValueSatisfying(e -> assertThat(e.isEmpty()).isFalse());
        }

        @Test
        @DisplayName("No retry when retryOnEmpty is off")
        void retryDisabled() {
            AtomicInteger retries = new AtomicInteger();
            FetchOptions options = FetchOptions.builder()
                    .retryOnEmpty(false)
                    .retryFetch(counting(retries, UNIVERSE))
                    .build();

            InstrumentFetchResult result = cache.getOrFetch("NFO", List::of, options);

            assertThat(result.isEmpty()).isTrue();
            assertThat(retries).hasValue(0);
        }
    }

    @Nested
    @DisplayName("Failed fetches")
    class Failures {

        @Test
        @DisplayName("A failing fetch is cached as empty and does not throw")
        void failureCachedAsEmpty() {
            InstrumentFetchResult result = cache.getOrFetch("BFO", () -> {
                throw new IllegalStateException("connection reset");
            });

            assertThat(result.isEmpty()).isTrue();
            assertThat(cache.getFetchFailures()).isEqualTo(1);
            assertThat(cache.peek("BFO")).isPresent();
        }

        @Test
        @DisplayName("The failure entry is back-dated so the next lookup refetches")
        void failureIsRefetched() {
            AtomicInteger calls = new AtomicInteger();
            cache.getOrFetch("BFO", () -> {
                throw new IllegalStateException("connection reset");
            });

            InstrumentFetchResult next = cache.getOrFetch("BFO", counting(calls, UNIVERSE));

            assertThat(next.isFromCache()).isFalse();
            assertThat(calls).hasValue(1);
        }
    }

    @Test
    @DisplayName("purge and invalidate drop entries")
    void purgeAndInvalidate() {
        cache.getOrFetch("NFO", () -> UNIVERSE);
        cache.getOrFetch("BFO", () -> UNIVERSE);

        cache.invalidate("nfo");
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.purge()).isEqualTo(1);
        assertThat(cache.size()).isZero();
        assertThat(cache.getCacheName()).isEqualTo("instruments");
    }
}
