package com.chaincollector.unit.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.chaincollector.cache.QuoteCache;
import com.chaincollector.unit.support.Fixtures;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QuoteCacheTest {

    @Test
    @DisplayName("Quotes expire after the write TTL")
    void expiresAfterTtl() {
        AtomicLong nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        QuoteCache cache = new QuoteCache(Duration.ofSeconds(2), 100, ticker);
        cache.putAll(Map.of("NFO:NIFTY25JUN24800CE", Fixtures.quote("120.5", 10, 1000)));

        assertThat(cache.getAllPresent(List.of("NFO:NIFTY25JUN24800CE", "NFO:NIFTY25JUN24800PE")))
                .containsOnlyKeys("NFO:NIFTY25JUN24800CE");

        nanos.addAndGet(Duration.ofSeconds(3).toNanos());
        assertThat(cache.getAllPresent(List.of("NFO:NIFTY25JUN24800CE"))).isEmpty();
    }

    @Test
    @DisplayName("purge empties the cache")
    void purge() {
        QuoteCache cache = new QuoteCache(Duration.ofSeconds(30), 100);
        cache.putAll(Map.of("a", Fixtures.quote("1", 1, 1), "b", Fixtures.quote("2", 1, 1)));

        cache.purge();

        assertThat(cache.getAllPresent(List.of("a", "b"))).isEmpty();
        assertThat(cache.getCacheName()).isEqualTo("quotes");
    }
}
