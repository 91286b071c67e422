package com.chaincollector.cache;

import com.chaincollector.domain.model.OptionQuote;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Short-lived quote cache keyed by {@code exchange:tradingSymbol}, so indices sharing a cycle
 * (and the ATM lookup plus index-data call of one index) do not re-quote the same symbol.
 */
public class QuoteCache implements Purgeable {

    private final Cache<String, OptionQuote> quotes;

    public QuoteCache(Duration ttl, long maximumSize) {
        this(ttl, maximumSize, Ticker.systemTicker());
    }

    /** Testable version: explicit ticker. */
    public QuoteCache(Duration ttl, long maximumSize, Ticker ticker) {
        this.quotes = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(ticker)
                .build();
    }

    public Map<String, OptionQuote> getAllPresent(Collection<String> keys) {
        return quotes.getAllPresent(keys);
    }

    public void putAll(Map<String, OptionQuote> fresh) {
        quotes.putAll(fresh);
    }

    @Override
    public int purge() {
        int removed = (int) quotes.estimatedSize();
        quotes.invalidateAll();
        return removed;
    }

    @Override
    public String getCacheName() {
        return "quotes";
    }
}
