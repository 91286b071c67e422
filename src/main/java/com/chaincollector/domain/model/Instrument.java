package com.chaincollector.domain.model;

import com.chaincollector.domain.enums.OptionKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * An instrument from the broker's instruments dump for one exchange (NFO, BFO, NSE, BSE).
 *
 * <p>Immutable once fetched. The instrument cache owns the list per exchange and replaces
 * it wholesale on refresh.
 *
 * @see com.chaincollector.cache.InstrumentCache
 */
@Value
@Builder
public class Instrument {

    /** Kite's numeric instrument identifier. */
    long token;

    /** Exchange code, e.g. "NFO". */
    String exchange;

    /** Exchange trading symbol, e.g. "NIFTY25JUN24800CE". */
    String tradingSymbol;

    /** Root name, e.g. "NIFTY". */
    String name;

    /** Kite segment, e.g. "NFO-OPT", "BFO-OPT", "INDICES". */
    String segment;

    /** Null for non-option instruments. */
    BigDecimal strike;

    LocalDate expiry;

    /** Null for futures and equities. */
    OptionKind kind;

    int lotSize;

    /** Key used by quote calls: "exchange:tradingSymbol". */
    public String getQuoteKey() {
        return exchange + ":" + tradingSymbol;
    }

    /**
     * True when this instrument is a derivative of {@code index}: the trading symbol contains the
     * index name and, when a root name is present, it equals the index name. The second check
     * keeps NIFTY from matching BANKNIFTY or FINNIFTY contracts.
     */
    public boolean belongsTo(String index) {
        if (tradingSymbol == null || index == null) {
            return false;
        }
        String symbol = index.toUpperCase();
        if (!tradingSymbol.toUpperCase().contains(symbol)) {
            return false;
        }
        return name == null || name.isBlank() || name.equalsIgnoreCase(symbol);
    }

    public boolean isOption() {
        return segment != null && segment.toUpperCase().endsWith("-OPT");
    }
}
