package com.chaincollector.collector;

import com.chaincollector.broker.MarketDataProvider;
import com.chaincollector.cache.FetchOptions;
import com.chaincollector.cache.InstrumentCache;
import com.chaincollector.cache.QuoteCache;
import com.chaincollector.calendar.ExpiryCalendarService;
import com.chaincollector.calendar.TradingCalendarService;
import com.chaincollector.config.CacheProperties;
import com.chaincollector.domain.IndexMeta;
import com.chaincollector.domain.IndexRegistry;
import com.chaincollector.domain.enums.ExpiryRule;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.IndexData;
import com.chaincollector.domain.model.Instrument;
import com.chaincollector.domain.model.OptionQuote;
import com.chaincollector.exception.ProviderException;
import com.chaincollector.exception.ResolveExpiryException;
import com.chaincollector.expiry.ExpiryResolver;
import com.chaincollector.expiry.StrikeLadder;
import com.chaincollector.resilience.ResilientCall;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The collector's single entry point to market data.
 *
 * <p>Every upstream call runs through {@link ResilientCall} under a named breaker
 * ({@value #LTP_BREAKER}, {@value #QUOTE_BREAKER}, {@value #INSTRUMENTS_BREAKER}), so retries
 * happen inside the breaker and a flapping endpoint opens only its own circuit. Instrument
 * dumps go through {@link InstrumentCache}; quotes through the short-lived {@link QuoteCache}.
 *
 * <p>Expiry resolution prefers dates listed in the instruments dump ({@link ExpiryResolver});
 * when the dump yields none at all, the rule calendar ({@link ExpiryCalendarService}) answers.
 */
public class ProviderFacade {

    private static final Logger log = LoggerFactory.getLogger(ProviderFacade.class);

    public static final String LTP_BREAKER = "kite.ltp";
    public static final String QUOTE_BREAKER = "kite.quote";
    public static final String INSTRUMENTS_BREAKER = "kite.instruments";

    static final int QUOTE_BATCH_SIZE = 500;

    private static final Comparator<Instrument> CHAIN_ORDER = Comparator.comparing(
                    Instrument::getStrike, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(i -> i.getKind() == null ? "" : i.getKind().name());

    private final MarketDataProvider provider;
    private final ResilientCall resilientCall;
    private final InstrumentCache instrumentCache;
    private final QuoteCache quoteCache;
    private final ExpiryResolver expiryResolver;
    private final ExpiryCalendarService expiryCalendarService;
    private final TradingCalendarService tradingCalendarService;
    private final CacheProperties cacheProperties;

    public ProviderFacade(
            MarketDataProvider provider,
            ResilientCall resilientCall,
            InstrumentCache instrumentCache,
            QuoteCache quoteCache,
            ExpiryResolver expiryResolver,
            ExpiryCalendarService expiryCalendarService,
            TradingCalendarService tradingCalendarService,
            CacheProperties cacheProperties) {
        this.provider = provider;
        this.resilientCall = resilientCall;
        this.instrumentCache = instrumentCache;
        this.quoteCache = quoteCache;
        this.expiryResolver = expiryResolver;
        this.expiryCalendarService = expiryCalendarService;
        this.tradingCalendarService = tradingCalendarService;
        this.cacheProperties = cacheProperties;
    }

    public Map<String, BigDecimal> getLtp(Collection<String> symbols) {
        List<String> keys = List.copyOf(new LinkedHashSet<>(symbols));
        return resilientCall.call(LTP_BREAKER, () -> provider.getLtp(keys));
    }

    /**
     * Quotes keyed by {@code exchange:symbol}. Symbols quoted within the quote TTL are served
     * from cache; only the rest go upstream.
     */
    public Map<String, OptionQuote> getQuote(Collection<String> symbols) {
        Set<String> wanted = new LinkedHashSet<>(symbols);
        Map<String, OptionQuote> result = new LinkedHashMap<>(quoteCache.getAllPresent(wanted));
        List<String> missing = new ArrayList<>();
        for (String symbol : wanted) {
            if (!result.containsKey(symbol)) {
                missing.add(symbol);
            }
        }
        if (!missing.isEmpty()) {
            Map<String, OptionQuote> fetched = resilientCall.call(QUOTE_BREAKER, () -> provider.getQuote(missing));
            quoteCache.putAll(fetched);
            result.putAll(fetched);
        }
        return result;
    }

    /**
     * Spot price, day OHLC and ATM strike of an index.
     *
     * @throws ProviderException when the broker returns no usable quote for the index
     */
    public IndexData getIndexData(String index) {
        IndexMeta meta = IndexRegistry.get(index);
        OptionQuote quote = getQuote(List.of(meta.getQuoteSymbol())).get(meta.getQuoteSymbol());
        if (quote == null || quote.getLastPrice() == null || quote.getLastPrice().signum() <= 0) {
            throw new ProviderException("No usable quote for " + meta.getQuoteSymbol());
        }
        return IndexData.builder()
                .index(meta.getSymbol())
                .price(quote.getLastPrice())
                .ohlc(quote.getOhlc())
                .atmStrike(StrikeLadder.atmFromPrice(quote.getLastPrice().doubleValue()))
                .build();
    }

    /**
     * ATM strike from the index LTP, or the index's default ATM when the LTP is unavailable.
     */
    public int getAtmStrike(String index) {
        IndexMeta meta = IndexRegistry.get(index);
        try {
            BigDecimal ltp = getLtp(List.of(meta.getQuoteSymbol())).get(meta.getQuoteSymbol());
            if (ltp != null && ltp.signum() > 0) {
                return StrikeLadder.atmFromPrice(ltp.doubleValue());
            }
            log.warn("No LTP for {}, using default ATM {}", meta.getQuoteSymbol(), meta.getDefaultAtm());
        } catch (RuntimeException e) {
            log.warn("LTP lookup for {} failed, using default ATM {}: {}", index, meta.getDefaultAtm(), e.getMessage());
        }
        return meta.getDefaultAtm();
    }

    /** All listed (or fabricated) expiries of an index, ascending. */
    public List<LocalDate> resolveExpiryDates(String index) {
        IndexMeta meta = IndexRegistry.get(index);
        return expiryResolver.resolve(
                meta.getSymbol(),
                () -> instrumentUniverse(meta.getOptionExchange()),
                () -> getAtmStrike(meta.getSymbol()),
                tradingCalendarService.today());
    }

    /**
     * The expiry date an expiry rule refers to today.
     *
     * @throws ResolveExpiryException when neither the instruments dump nor the rule calendar
     *     gives a date
     */
    public LocalDate resolveExpiry(String index, ExpiryRule rule) {
        List<LocalDate> dates = resolveExpiryDates(index);
        if (!dates.isEmpty()) {
            return expiryResolver.selectForRule(index, dates, rule);
        }
        LocalDate today = tradingCalendarService.today();
        return expiryCalendarService
                .expiryFor(index, rule, today)
                .map(date -> {
                    log.info("No listed expiries for {}, {} from rule calendar: {}", index, rule, date);
                    return date;
                })
                .orElseThrow(() -> new ResolveExpiryException(
                        index, rule.getCode(), "no listed expiries and no calendar rule"));
    }

    /**
     * Option contracts of {@code index} expiring on {@code expiry} at the given strikes, ordered
     * by strike then CE before PE.
     */
    public List<Instrument> getOptionInstruments(String index, LocalDate expiry, Collection<Integer> strikes) {
        IndexMeta meta = IndexRegistry.get(index);
        Set<Integer> wanted = new HashSet<>(strikes);
        List<Instrument> matched = new ArrayList<>();
        for (Instrument instrument : instrumentUniverse(meta.getOptionExchange())) {
            if (!instrument.isOption()
                    || !expiry.equals(instrument.getExpiry())
                    || !instrument.belongsTo(meta.getSymbol())) {
                continue;
            }
            BigDecimal strike = instrument.getStrike();
            if (strike != null && isWholeNumber(strike) && wanted.contains(strike.intValue())) {
                matched.add(instrument);
            }
        }
        matched.sort(CHAIN_ORDER);
        log.debug("{} {} options matched {} strikes for {}", matched.size(), index, wanted.size(), expiry);
        return matched;
    }

    /**
     * Joins instruments with live quotes, quoting in batches of {@value #QUOTE_BATCH_SIZE}.
     * Instruments without a quote are dropped. A failed batch is skipped; if every batch failed
     * the last failure is rethrown.
     */
    public List<EnrichedOption> enrichWithQuotes(List<Instrument> instruments) {
        if (instruments.isEmpty()) {
            return List.of();
        }
        Map<String, OptionQuote> quotes = new LinkedHashMap<>();
        RuntimeException lastFailure = null;
        int failedBatches = 0;
        int batches = 0;
        for (int from = 0; from < instruments.size(); from += QUOTE_BATCH_SIZE) {
            batches++;
            List<String> keys = new ArrayList<>();
            for (Instrument instrument : instruments.subList(from, Math.min(from + QUOTE_BATCH_SIZE, instruments.size()))) {
                keys.add(instrument.getQuoteKey());
            }
            try {
                quotes.putAll(getQuote(keys));
            } catch (RuntimeException e) {
                failedBatches++;
                lastFailure = e;
                log.warn("Quote batch of {} failed: {}", keys.size(), e.getMessage());
            }
        }
        if (lastFailure != null && failedBatches == batches) {
            throw lastFailure;
        }

        List<EnrichedOption> enriched = new ArrayList<>(instruments.size());
        for (Instrument instrument : instruments) {
            OptionQuote quote = quotes.get(instrument.getQuoteKey());
            if (quote != null) {
                enriched.add(new EnrichedOption(instrument, quote));
            }
        }
        return enriched;
    }

    // ---- Private helpers ----

    private List<Instrument> instrumentUniverse(String exchange) {
        Supplier<List<Instrument>> fetch =
                () -> resilientCall.call(INSTRUMENTS_BREAKER, () -> provider.getInstruments(exchange));
        FetchOptions options = FetchOptions.builder()
                .ttl(cacheProperties.getInstrumentTtl())
                .shortEmptyTtl(cacheProperties.getShortEmptyTtl())
                .retryFetch(fetch)
                .build();
        return instrumentCache.getOrFetch(exchange, fetch, options).getInstruments();
    }

    private static boolean isWholeNumber(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
