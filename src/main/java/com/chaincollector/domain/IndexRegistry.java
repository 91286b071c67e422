package com.chaincollector.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static registry of the F&amp;O indices the collector knows about.
 *
 * <p>NSE indices quote under display names with spaces ("NIFTY 50", "NIFTY BANK") while their
 * options trade on NFO under compact symbols ("NIFTY", "BANKNIFTY"). SENSEX and BANKEX are BSE
 * indices whose options trade on BFO.
 */
public final class IndexRegistry {

    private static final Map<String, IndexMeta> INDICES;

    static {
        Map<String, IndexMeta> map = new LinkedHashMap<>();
        register(map, "NIFTY", "NSE:NIFTY 50", "NFO", 50, 24800);
        register(map, "BANKNIFTY", "NSE:NIFTY BANK", "NFO", 100, 54000);
        register(map, "FINNIFTY", "NSE:NIFTY FIN SERVICE", "NFO", 50, 26000);
        register(map, "MIDCPNIFTY", "NSE:NIFTY MID SELECT", "NFO", 50, 12000);
        register(map, "SENSEX", "BSE:SENSEX", "BFO", 100, 81000);
        register(map, "BANKEX", "BSE:BANKEX", "BFO", 100, 0);
        INDICES = Collections.unmodifiableMap(map);
    }

    private IndexRegistry() {}

    private static void register(
            Map<String, IndexMeta> map, String symbol, String quoteSymbol, String exchange, int step, int atm) {
        map.put(
                symbol,
                IndexMeta.builder()
                        .symbol(symbol)
                        .quoteSymbol(quoteSymbol)
                        .optionExchange(exchange)
                        .strikeStep(step)
                        .defaultAtm(atm)
                        .build());
    }

    public static Optional<IndexMeta> find(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(INDICES.get(symbol.toUpperCase()));
    }

    /**
     * Returns metadata for a known index, or a generic NSE/NFO entry (step 50, no default ATM)
     * for an unknown one.
     */
    public static IndexMeta get(String symbol) {
        return find(symbol).orElseGet(() -> IndexMeta.builder()
                .symbol(symbol)
                .quoteSymbol("NSE:" + symbol)
                .optionExchange("NFO")
                .strikeStep(50)
                .defaultAtm(0)
                .build());
    }

    public static Set<String> symbols() {
        return INDICES.keySet();
    }
}
