package com.chaincollector.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Static metadata for one F&amp;O index.
 */
@Value
@Builder
public class IndexMeta {

    /** Derivatives underlying name, e.g. "NIFTY". */
    String symbol;

    /** Key used for spot LTP/quote calls, e.g. "NSE:NIFTY 50". */
    String quoteSymbol;

    /** Exchange whose instruments dump carries the options: "NFO" or "BFO". */
    String optionExchange;

    /** Distance between adjacent listed strikes. */
    int strikeStep;

    /** ATM strike assumed when the spot price is unavailable. */
    int defaultAtm;
}
